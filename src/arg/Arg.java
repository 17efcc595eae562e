package arg;

import java.io.PrintStream;

/**
 * 命令行参数: compiler [-v|--verbose] [-o filename] [filename]
 * 未给出源文件时从标准输入读入
 */
public class Arg {
    public final String srcFilename; // 源代码文件名, 为空则读 stdin
    public final String outFilename; // 报告输出文件名, 为空则写 stdout
    public final boolean verbose; // 是否在 stderr 输出各阶段跟踪信息
    public final boolean help;

    private Arg(String src, String out, boolean verbose, boolean help) {
        this.srcFilename = src;
        this.outFilename = out;
        this.verbose = verbose;
        this.help = help;
    }

    public boolean readStdin() {
        return srcFilename.isEmpty();
    }

    public boolean writeStdout() {
        return outFilename.isEmpty();
    }

    public static Arg parse(String[] args) {
        String src = "", out = "";
        boolean verbose = false;
        boolean help = false;
        for (int i = 0; i < args.length; i++) {
            // detect "-h"
            if ("-h".equals(args[i]) || "--help".equals(args[i])) {
                help = true;
                continue;
            }
            // detect "-v"
            if ("-v".equals(args[i]) || "--verbose".equals(args[i])) {
                verbose = true;
                continue;
            }
            // detect "-o"
            if ("-o".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("-o expected filename");
                }
                if (!out.isEmpty()) {
                    throw new IllegalArgumentException("We got more than one output file when we expected only one.");
                }
                out = args[++i];
                continue;
            }
            // detect illegal flags, a lone "-" means stdin
            if (args[i].startsWith("-") && !"-".equals(args[i])) {
                throw new IllegalArgumentException("invalid flag: " + args[i]);
            }
            // source file
            if (!src.isEmpty()) {
                throw new IllegalArgumentException("We got more than one source file when we expected only one.");
            }
            src = "-".equals(args[i]) ? "" : args[i];
        }
        return new Arg(src, out, verbose, help);
    }

    public static void printHelp(PrintStream err) {
        err.println("Usage: compiler [-v|--verbose] [-o filename] [filename]");
        err.println("reads the program from stdin when no filename is given");
    }
}
