/*
 * This file is part of JROBDD.
 * Copyright (c) 2023 The JROBDD authors.
 *
 * JROBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JROBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JROBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.robdd;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Command line front end: {@code RobddCli <formula> [--ordering a,b,c] [-o name]}. Builds the
 * diagram of the formula and writes it to {@code name.dot}.
 */
public final class RobddCli {
    private static final Logger logger = Logger.getLogger(RobddCli.class.getName());

    static final String DEFAULT_OUTPUT = "robdd_output";

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_PARSE_ERROR = 1;
    static final int EXIT_ORDERING_ERROR = 2;
    static final int EXIT_USAGE = 64;

    private static final String USAGE = "Usage: RobddCli <formula> [--ordering a,b,c] [-o|--output name]";

    private RobddCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        String formulaString = null;
        String orderingString = null;
        String output = DEFAULT_OUTPUT;

        for (int i = 0; i < args.length; i++) {
            String argument = args[i];
            if ("--ordering".equals(argument) || "-o".equals(argument) || "--output".equals(argument)) {
                String value = optionValue(args, i);
                if (value == null) {
                    err.println("Missing value for option " + argument);
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
                if ("--ordering".equals(argument)) {
                    orderingString = value;
                } else {
                    output = value;
                }
                i += 1;
            } else if (formulaString == null) {
                formulaString = argument;
            } else {
                err.println("Unexpected argument " + argument);
                err.println(USAGE);
                return EXIT_USAGE;
            }
        }
        if (formulaString == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        out.println("Formula String: " + formulaString);
        Formula formula;
        try {
            formula = FormulaParser.parse(formulaString);
        } catch (FormulaParseException e) {
            err.println("Parsing Error: " + e.getMessage());
            return EXIT_PARSE_ERROR;
        }
        out.println("Parsed Formula: " + formula);

        Robdd robdd = RobddFactory.buildRobdd();
        int root;
        try {
            VariableOrdering ordering;
            if (orderingString == null) {
                ordering = VariableOrdering.alphabetical(formula);
                out.println("Variable Ordering (alphabetical): " + ordering);
            } else {
                ordering = VariableOrdering.parse(orderingString);
                out.println("Variable Ordering (user-defined): " + ordering);
            }
            root = robdd.build(formula, ordering);
        } catch (OrderingException e) {
            err.println("Ordering Error: " + e.getMessage());
            return EXIT_ORDERING_ERROR;
        }
        out.println("ROBDD Root ID: " + root);

        Path path = Path.of(output + ".dot");
        try {
            DotExporter.write(robdd, root, path);
            out.println("ROBDD saved to: " + path);
        } catch (IOException e) {
            // The diagram itself is valid, only the export failed
            logger.log(Level.WARNING, "Could not write " + path, e);
            err.println("Could not write " + path + ": " + e.getMessage());
        }
        return EXIT_SUCCESS;
    }

    @Nullable
    private static String optionValue(String[] args, int index) {
        return index + 1 < args.length ? args[index + 1] : null;
    }
}
