package io.github.eutro.qdebug.api;

import io.github.eutro.qdebug.parsing.Preprocessor;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class Cli {
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) System.exit(status);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> paths = new ArrayList<>();
        boolean quiet = false;
        boolean verify = Preprocessor.VERIFY_BY_DEFAULT;
        boolean suppressFlags = false;
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp(out);
                        return 0;
                    case "-q":
                    case "--quiet":
                        quiet = true;
                        break;
                    case "--verify":
                        verify = true;
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        err.printf("%s: unknown flag%n", arg);
                        return 1;
                }
                continue;
            }
            paths.add(arg);
        }
        if (paths.isEmpty()) {
            printHelp(err);
            return 1;
        }

        QasmLoader loader = new QasmLoader(new Preprocessor().setVerify(verify));
        int status = 0;
        for (String pathName : paths) {
            Path path = Paths.get(pathName);
            LoadResult result;
            try {
                result = loader.load(path);
            } catch (IOException e) {
                err.printf("could not read file %s: %s%n", path, e);
                return 1;
            }
            if (!result.isOk()) {
                err.printf("%s:%d:%d: %s%n", path, result.getLine(), result.getColumn(), result.getMessage());
                status = 2;
                continue;
            }
            if (!quiet) {
                if (paths.size() > 1) out.printf("%s:%n", path);
                out.print(InstructionPrinter.print(result.getProgram()));
            }
        }
        return status;
    }

    private static void printHelp(PrintStream out) {
        out.println(
                "usage: qdebug [-h|--help] [-q|--quiet] [--verify] <file> ...\n" +
                        "\n" +
                        "  <file> : a program to load and print the instructions of\n" +
                        "  -q|--quiet : only report errors\n" +
                        "  --verify : check the structure of each loaded program\n" +
                        "  -h|--help : show this help"
        );
    }
}
