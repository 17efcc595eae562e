package frontend.semantic.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

/**
 * 唯一的一层符号表(语言只有一个全局作用域, 无嵌套, 无遮蔽)
 * 生命周期为一次编译
 */
public class SymTable {
    // 从变量名映射到完整信息
    private final HashMap<String, Symbol> nameSymMap = new HashMap<>();

    // 首次声明的顺序, 仅用于输出
    private final ArrayList<Symbol> declOrder = new ArrayList<>();

    // 添加变量, 调用方需先判断重定义
    public void add(Symbol symbol) {
        assert !nameSymMap.containsKey(symbol.getName());
        nameSymMap.put(symbol.getName(), symbol);
        declOrder.add(symbol);
    }

    public Symbol get(String name) {
        return nameSymMap.get(name);
    }

    public boolean contains(String name) {
        return nameSymMap.containsKey(name);
    }

    public List<Symbol> getDeclOrder() {
        return Collections.unmodifiableList(declOrder);
    }

    public int size() {
        return declOrder.size();
    }
}
