/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libonig.tool;

import com.axonops.libonig.api.MatchFlag;
import com.axonops.libonig.api.Onig;
import com.axonops.libonig.api.OnigException;
import com.axonops.libonig.api.Pattern;
import com.axonops.libonig.api.PatternCompilationException;
import com.axonops.libonig.api.SyntaxOption;
import com.axonops.libonig.encoding.CodeUnit;
import com.axonops.libonig.encoding.Subject;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * {@code re_replace [-i] [-w] PATTERN REPLACEMENT [FILE...]}
 *
 * <p>Replaces every match of an ECMAScript pattern with an ECMAScript replacement template. With no
 * FILE, reads stdin and writes stdout. Without {@code -w} the replaced contents of each FILE are
 * written to stdout; with it each FILE is rewritten in place.
 *
 * <p>Input and output are UTF-8. Bytes outside the matches are copied through unchanged.
 *
 * <p>Exit status is 0 on success, otherwise the code of the last failure:
 * <ul>
 *   <li>{@value #EXIT_USAGE} - usage error or unknown option</li>
 *   <li>{@value #EXIT_COMPILE} - pattern does not compile</li>
 *   <li>{@value #EXIT_STDIN_READ} / {@value #EXIT_STDIN_REPLACE} - stdin read / replacement failure</li>
 *   <li>{@value #EXIT_FILE_OPEN} / {@value #EXIT_FILE_READ} / {@value #EXIT_FILE_REPLACE} - file open,
 *       read or replacement failure</li>
 *   <li>{@value #EXIT_FILE_OPEN_WRITE} / {@value #EXIT_FILE_WRITE} - file cannot be opened for writing
 *       / write failure</li>
 * </ul>
 */
public final class ReReplace {
    private static final Logger logger = LoggerFactory.getLogger(ReReplace.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_COMPILE = 3;
    public static final int EXIT_STDIN_READ = 4;
    public static final int EXIT_STDIN_REPLACE = 5;
    public static final int EXIT_FILE_OPEN = 6;
    public static final int EXIT_FILE_READ = 7;
    public static final int EXIT_FILE_REPLACE = 8;
    public static final int EXIT_FILE_OPEN_WRITE = 9;
    public static final int EXIT_FILE_WRITE = 10;

    static final String NAME = "re_replace";
    static final String SYNTAX = NAME + " [-i] [-w] PATTERN REPLACEMENT [FILE...]";

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    ReReplace(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Runs the tool and returns its exit status.
     */
    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        return new ReReplace(in, out, err).execute(args);
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("i").longOpt("ignore-case").desc("case-insensitive matching").build());
        options.addOption(Option.builder("w").longOpt("write").desc("rewrite each FILE in place").build());
        options.addOption(Option.builder("h").longOpt("help").desc("print this help and exit").build());
        return options;
    }

    int execute(String[] args) {
        Options options = buildOptions();
        CommandLineParser parser = new DefaultParser();
        CommandLine cl;
        try {
            cl = parser.parse(options, args);
        } catch (ParseException e) {
            err.println(NAME + ": " + e.getMessage());
            printHelp(options, err);
            return EXIT_USAGE;
        }

        if (cl.hasOption("h")) {
            printHelp(options, out);
            return EXIT_OK;
        }

        List<String> positional = cl.getArgList();
        if (positional.size() < 2) {
            err.println(NAME + ": PATTERN and REPLACEMENT are required");
            printHelp(options, err);
            return EXIT_USAGE;
        }

        Set<SyntaxOption> syntax = EnumSet.of(SyntaxOption.ECMASCRIPT);
        if (cl.hasOption("i")) {
            syntax.add(SyntaxOption.ICASE);
        }
        boolean inPlace = cl.hasOption("w");
        String template = positional.get(1);
        List<String> files = positional.subList(2, positional.size());

        Pattern pattern;
        try {
            pattern = Pattern.compile(positional.get(0), CodeUnit.UTF8, syntax);
        } catch (PatternCompilationException e) {
            err.println(NAME + ": " + e.getMessage());
            return EXIT_COMPILE;
        }

        try {
            if (files.isEmpty()) {
                return replaceStdin(pattern, template);
            }
            int status = EXIT_OK;
            for (String file : files) {
                int fileStatus = replaceFile(Paths.get(file), pattern, template, inPlace);
                if (fileStatus != EXIT_OK) {
                    status = fileStatus;
                }
            }
            return status;
        } finally {
            pattern.close();
        }
    }

    private int replaceStdin(Pattern pattern, String template) {
        byte[] input;
        try {
            input = in.readAllBytes();
        } catch (IOException e) {
            err.println(NAME + ": cannot read stdin: " + e.getMessage());
            return EXIT_STDIN_READ;
        }
        byte[] output;
        try {
            output = replace(input, pattern, template);
        } catch (OnigException e) {
            err.println(NAME + ": replacement failed on stdin: " + e.getMessage());
            return EXIT_STDIN_REPLACE;
        }
        out.write(output, 0, output.length);
        out.flush();
        return EXIT_OK;
    }

    private int replaceFile(Path file, Pattern pattern, String template, boolean inPlace) {
        logger.debug("Onig: re_replace processing {}", file);
        byte[] input;
        try (InputStream stream = open(file)) {
            try {
                input = stream.readAllBytes();
            } catch (IOException e) {
                err.println(NAME + ": cannot read " + file + ": " + e.getMessage());
                return EXIT_FILE_READ;
            }
        } catch (IOException e) {
            err.println(NAME + ": cannot open " + file + ": " + e.getMessage());
            return EXIT_FILE_OPEN;
        }

        byte[] output;
        try {
            output = replace(input, pattern, template);
        } catch (OnigException e) {
            err.println(NAME + ": replacement failed on " + file + ": " + e.getMessage());
            return EXIT_FILE_REPLACE;
        }

        if (!inPlace) {
            out.write(output, 0, output.length);
            out.flush();
            return EXIT_OK;
        }

        OutputStream stream;
        try {
            stream = Files.newOutputStream(file);
        } catch (IOException e) {
            err.println(NAME + ": cannot open " + file + " for writing: " + e.getMessage());
            return EXIT_FILE_OPEN_WRITE;
        }
        try (stream) {
            stream.write(output);
        } catch (IOException e) {
            err.println(NAME + ": cannot write " + file + ": " + e.getMessage());
            return EXIT_FILE_WRITE;
        }
        return EXIT_OK;
    }

    /**
     * Replaces at byte level; bytes outside matches are written back exactly as read.
     */
    private static byte[] replace(byte[] input, Pattern pattern, String template) {
        return Onig.replaceUnits(Subject.utf8(input), pattern, template, MatchFlag.NONE).toByteArray();
    }

    private static InputStream open(Path file) throws IOException {
        if (Files.isDirectory(file)) {
            throw new IOException("is a directory");
        }
        return Files.newInputStream(file);
    }

    private static void printHelp(Options options, PrintStream stream) {
        PrintWriter writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, SYNTAX,
            "Replace ECMAScript regex matches in FILEs (or stdin).", options,
            HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }
}
