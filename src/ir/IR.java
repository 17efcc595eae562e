package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次编译生成的全部三地址码, 按发射顺序
 */
public class IR {
    private final ArrayList<Instr> instrs = new ArrayList<>();
    private int tempCnt = 0;

    public void add(Instr instr) {
        instrs.add(instr);
    }

    // 先自增再取名: t1, t2, ...
    public String newTemp() {
        return "t" + (++tempCnt);
    }

    public int getTempCnt() {
        return tempCnt;
    }

    public List<Instr> getInstrs() {
        return Collections.unmodifiableList(instrs);
    }

    public List<String> output() {
        List<String> lines = new ArrayList<>();
        for (Instr instr : instrs) {
            lines.add(instr.toString());
        }
        return lines;
    }
}
