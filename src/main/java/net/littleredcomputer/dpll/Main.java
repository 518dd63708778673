package net.littleredcomputer.dpll;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.primitives.Ints;
import net.littleredcomputer.dpll.tseitin.FormulaTranslator;
import net.littleredcomputer.dpll.tseitin.TseitinEncoder;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkState;

public class Main {
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private static final String modeNames = Joiner.on(" or ").join(
            Arrays.stream(TseitinEncoder.Mode.values()).map(TseitinEncoder.Mode::optionName).iterator());

    static Options options() {
        return new Options()
                .addOption("task", true, "translate or sat")
                .addOption("problem", true, "filename of problem description, - for stdin")
                .addOption("format", true, "format of problem file: formula or cnf")
                .addOption("mode", true, "Tseitin encoding: " + modeNames)
                .addOption("output", true, "file to receive the translated formula")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(p), StandardCharsets.UTF_8));
    }

    private static String format(CommandLine cmd) {
        if (cmd.hasOption("format")) return cmd.getOptionValue("format");
        return cmd.getOptionValue("problem", "").endsWith(".sat") ? "formula" : "cnf";
    }

    private static TseitinEncoder.Mode mode(CommandLine cmd, TseitinEncoder.Mode defaultMode) {
        return cmd.hasOption("mode") ? TseitinEncoder.Mode.fromOptionName(cmd.getOptionValue("mode")) : defaultMode;
    }

    // The formula is expected on the first line of its input.
    private static String firstLine(Reader r) throws IOException {
        try (BufferedReader br = new BufferedReader(r)) {
            String line = br.readLine();
            if (line == null) throw new IllegalArgumentException("Missing formula");
            return line;
        }
    }

    private static SATProblem satProblem(CommandLine cmd) throws IOException {
        switch (format(cmd)) {
            case "cnf":
                try (Reader r = problem(cmd)) {
                    return SATProblem.parseFrom(r);
                }
            case "formula":
                // Left-to-right gives fewer clauses, and is all the solver needs.
                return new FormulaTranslator(mode(cmd, TseitinEncoder.Mode.LEFT_TO_RIGHT))
                        .translate(firstLine(problem(cmd)))
                        .problem();
            default:
                throw new IllegalArgumentException("unknown problem format");
        }
    }

    static void checkModel(SATProblem p, int[] model) {
        checkState(p.evaluate(model), "model does not satisfy the problem: %s", Arrays.toString(model));
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        switch (task) {
            case "translate": {
                String dimacs = new FormulaTranslator(mode(cmd, TseitinEncoder.Mode.EQUIVALENCE))
                        .translate(firstLine(problem(cmd)))
                        .toDimacs();
                if (cmd.hasOption("output")) {
                    try (Writer w = new OutputStreamWriter(new FileOutputStream(cmd.getOptionValue("output")), StandardCharsets.UTF_8)) {
                        w.write(dimacs);
                    }
                } else {
                    System.out.print(dimacs);
                }
                break;
            }
            case "sat": {
                SATProblem p = satProblem(cmd);
                Stopwatch sw = Stopwatch.createStarted();
                DPLLSolver s = new DPLLSolver();
                s.setLogInterval(logInterval(cmd));
                boolean sat = s.solve(p);
                sw.stop();
                System.out.println("c " + sw);
                if (sat) {
                    int[] model = s.model().orElseThrow(() -> new IllegalStateException("satisfiable without a model"));
                    checkModel(p, model);
                    System.out.println("s SATISFIABLE");
                    System.out.println("v " + spaceJoiner.join(Ints.asList(model)) + (model.length > 0 ? " 0" : "0"));
                } else {
                    System.out.println("s UNSATISFIABLE");
                }
                System.out.println("c decisions " + s.decisions());
                System.out.println("c propagations " + s.propagations());
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }
}
