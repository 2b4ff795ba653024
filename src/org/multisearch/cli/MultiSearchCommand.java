/*
 * @LICENSE@
 */
package org.multisearch.cli;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

import joptsimple.NonOptionArgumentSpec;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import org.multisearch.CodePointSource;
import org.multisearch.DecodingSource;
import org.multisearch.LowerCaseSource;
import org.multisearch.Match;
import org.multisearch.Matches;
import org.multisearch.SearchTrie;
import org.multisearch.Searcher;

/**
 * Searches standard input, a file, or the files of a directory for multiple
 * terms, printing one tab separated line per match.
 */
public class MultiSearchCommand extends Command {

    static final Logger logger = Logger.getLogger("org.multisearch.cli");
    private static final Level level = Level.FINE;

    private final OptionSpec<File> termFileOption = parser
        .accepts("termfile", "File containing search terms, separated by whitespace. May be specified multiple times.")
        .withRequiredArg().ofType(File.class);
    private final OptionSpec<File> searchPathOption = parser
        .accepts("searchpath", "File in which to search. If a directory, contained files are searched. Defaults to stdin.")
        .withRequiredArg().ofType(File.class);
    private final OptionSpec<File> outputOption = parser
        .accepts("output", "File where results are written; must not exist. Defaults to stdout.")
        .withRequiredArg().ofType(File.class);
    private final OptionSpec<Integer> threadsOption = parser
        .accepts("threads", "Number of files searched at once.")
        .withRequiredArg().ofType(Integer.class)
        .defaultsTo(Runtime.getRuntime().availableProcessors());
    private final OptionSpec<Void> recursiveOption = parser
        .accepts("r", "Search all subdirectories of searchpath.");
    private final OptionSpec<Void> caseInsensitiveOption = parser
        .accepts("i", "Perform a case-insensitive search.");
    private final NonOptionArgumentSpec<String> termsArgument = parser
        .nonOptions("search terms");

    private final InputStream stdin;

    public MultiSearchCommand() {
        this(System.in);
    }

    MultiSearchCommand(InputStream stdin) {
        super("Multisearch searches for multiple terms in some text.");
        this.stdin = stdin;
    }

    public static void main(String[] args) throws Exception {
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        PrintWriter err = new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8));
        exit(new MultiSearchCommand().main(args, out, err));
    }

    @Override
    protected void printAdditionalHelp(PrintWriter pw) {
        pw.println("Usage:");
        pw.println();
        pw.println("    multisearch [--termfile path]... [--searchpath path [-r]] [-i] [search_term...]");
        pw.println();
    }

    @Override
    protected void execute(OptionSet options, PrintWriter out, PrintWriter err) throws Exception {
        final boolean fold = options.has(caseInsensitiveOption);
        final List<String> terms = terms(options, fold);
        if (terms.isEmpty()) {
            throw new UserError(ExitCodes.USAGE, "no search terms specified");
        }
        if (options.has(recursiveOption) && !options.has(searchPathOption)) {
            throw new UserError(ExitCodes.USAGE, "-r may only be specified along with --searchpath");
        }
        int threads = options.valueOf(threadsOption);
        if (threads < 1) {
            throw new UserError(ExitCodes.USAGE, "--threads must be at least 1: " + threads);
        }

        SearchTrie trie = SearchTrie.build(terms);
        logger.log(level, "searching for " + trie.termCount() + " terms");

        PrintWriter results = out;
        if (options.has(outputOption)) {
            results = openOutput(options.valueOf(outputOption));
        }
        try {
            if (!options.has(searchPathOption)) {
                searchStream(trie, new DecodingSource(stdin), fold, results);
            } else {
                File path = options.valueOf(searchPathOption);
                if (!path.exists()) {
                    throw new UserError(ExitCodes.NO_INPUT, "search file [" + path + "] does not exist");
                }
                if (path.isDirectory()) {
                    List<File> files = new ArrayList<File>();
                    listFiles(path, options.has(recursiveOption), files);
                    searchFiles(trie, files, fold, threads, results, err);
                } else {
                    DecodingSource in;
                    try {
                        in = new DecodingSource(path);
                    } catch (FileNotFoundException e) {
                        throw new UserError(ExitCodes.NO_INPUT, "opening search file [" + path + "]: " + e.getMessage(), e);
                    }
                    try {
                        searchStream(trie, in, fold, results);
                    } finally {
                        in.close();
                    }
                }
            }
        } finally {
            if (results != out) {
                results.close();
            }
        }
    }

    private List<String> terms(OptionSet options, boolean fold) throws UserError {
        List<String> terms = new ArrayList<String>();
        for (File termFile : options.valuesOf(termFileOption)) {
            terms.addAll(TermFiles.read(termFile));
        }
        for (String arg : termsArgument.values(options)) {
            String term = arg.trim();
            if (term.length() != 0) {
                terms.add(term);
            }
        }
        if (fold) {
            for (int i = 0; i < terms.size(); ++i) {
                terms.set(i, LowerCaseSource.fold(terms.get(i)));
            }
        }
        return terms;
    }

    private static PrintWriter openOutput(File file) throws UserError {
        if (file.isDirectory()) {
            throw new UserError(ExitCodes.CANT_CREATE, "output file [" + file + "] is a directory");
        }
        if (file.exists()) {
            throw new UserError(ExitCodes.CANT_CREATE, "output file [" + file + "] already exists");
        }
        try {
            return new PrintWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8));
        } catch (FileNotFoundException e) {
            throw new UserError(ExitCodes.CANT_CREATE, "opening output file [" + file + "]: " + e.getMessage(), e);
        }
    }

    /**
     * The files directly in <code>dir</code>, and those in its subdirectories
     * if <code>recursive</code>; in name order.
     */
    static void listFiles(File dir, boolean recursive, List<File> files) {
        File[] entries = dir.listFiles();
        if (entries == null) {
            logger.log(level, "cannot list " + dir);
            return;
        }
        Arrays.sort(entries);
        for (File f : entries) {
            if (f.isDirectory()) {
                if (recursive) {
                    listFiles(f, recursive, files);
                }
            } else {
                files.add(f);
            }
        }
    }

    private static CodePointSource maybeFold(CodePointSource in, boolean fold) {
        return fold ? new LowerCaseSource(in) : in;
    }

    private static void searchStream(Searcher searcher, CodePointSource in, boolean fold, PrintWriter out)
            throws UserError {
        out.println("Term\tStart\tEnd");
        Matches matches = searcher.search(maybeFold(in, fold));
        for (Match m : matches) {
            out.println(m.term() + "\t" + m.start() + "\t" + m.end());
        }
        out.flush();
        if (matches.ioException() != null) {
            throw new UserError(ExitCodes.IO_ERROR, "reading input: " + matches.ioException().getMessage(),
                matches.ioException());
        }
    }

    /**
     * Searches the files concurrently. Lines are written whole, but lines of
     * different files interleave. A file which can't be read is reported on
     * <code>err</code> and skipped.
     */
    private static void searchFiles(final Searcher searcher, List<File> files, final boolean fold,
            int threads, final PrintWriter out, final PrintWriter err) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<Future<?>>();
            for (final File file : files) {
                futures.add(pool.submit(new Runnable() {
                    public void run() {
                        searchFile(searcher, file, fold, out, err);
                    }
                }));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    throw new IllegalStateException("search task failed", e.getCause());
                }
            }
        } finally {
            pool.shutdownNow();
            out.flush();
        }
    }

    private static void searchFile(Searcher searcher, File file, boolean fold, PrintWriter out, PrintWriter err) {
        DecodingSource in;
        try {
            in = new DecodingSource(file);
        } catch (FileNotFoundException e) {
            report(err, "opening search file [" + file + "]: " + e.getMessage());
            return;
        }
        try {
            Matches matches = searcher.search(maybeFold(in, fold));
            int count = 0;
            for (Match m : matches) {
                String line = file.getPath() + "\t" + m.term() + "\t" + m.start() + "\t" + m.end();
                synchronized (out) {
                    out.println(line);
                }
                ++count;
            }
            if (matches.ioException() != null) {
                report(err, "reading search file [" + file + "]: " + matches.ioException().getMessage());
            }
            logger.log(level, file + ": " + count + " matches");
        } finally {
            try {
                in.close();
            } catch (IOException e) {
                logger.log(level, "closing " + file, e);
            }
        }
    }

    private static void report(PrintWriter err, String msg) {
        synchronized (err) {
            err.println("ERROR: " + msg);
            err.flush();
        }
    }
}
