import arg.Arg;
import manage.CompileResult;
import manage.Manager;
import util.FileDealer;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;

public class Compiler {

    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO = 3;

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    public static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        Arg arg;
        try {
            arg = Arg.parse(args);
        } catch (IllegalArgumentException e) {
            Arg.printHelp(stderr);
            stderr.println("invalid arguments: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (arg.help) {
            Arg.printHelp(stderr);
            return CompileResult.EXIT_OK;
        }

        String source;
        try {
            source = arg.readStdin() ? FileDealer.input(stdin) : readFile(arg.srcFilename);
        } catch (IOException e) {
            stderr.println("cannot read source: " + e.getMessage());
            return EXIT_IO;
        }

        CompileResult result = new Manager(arg.verbose, stderr).compile(source);

        try {
            if (arg.writeStdout()) {
                FileDealer.outputToStream(result.getStdout(), stdout);
            } else {
                try (OutputStream out = new FileOutputStream(arg.outFilename)) {
                    FileDealer.outputToStream(result.getStdout(), out);
                }
            }
        } catch (IOException e) {
            stderr.println("cannot write output: " + e.getMessage());
            return EXIT_IO;
        }
        // 恰好一行诊断
        result.getError().ifPresent(error -> stderr.println(error.diagnostic()));
        return result.getExitCode();
    }

    private static String readFile(String filename) throws IOException {
        try (InputStream in = new FileInputStream(filename)) {
            return FileDealer.input(in);
        }
    }
}
