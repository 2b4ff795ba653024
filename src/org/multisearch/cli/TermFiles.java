/*
 * @LICENSE@
 */
package org.multisearch.cli;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

/**
 * Reads search terms from files: whitespace separated, so one term per line
 * works as well as several to a line.
 */
final class TermFiles {

    private TermFiles() {
    } // never instantiated

    static List<String> read(File file) throws UserError {
        Reader r;
        try {
            r = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8);
        } catch (FileNotFoundException e) {
            throw new UserError(ExitCodes.NO_INPUT, "opening term file [" + file + "]: " + e.getMessage(), e);
        }
        try {
            return read(r);
        } catch (IOException e) {
            throw new UserError(ExitCodes.IO_ERROR, "reading term file [" + file + "]: " + e.getMessage(), e);
        } finally {
            try {
                r.close();
            } catch (IOException e) {
                MultiSearchCommand.logger.log(Level.FINE, "closing " + file, e);
            }
        }
    }

    static List<String> read(Reader r) throws IOException {
        List<String> ret = new ArrayList<String>();
        BufferedReader br = new BufferedReader(r);
        String line;
        while ((line = br.readLine()) != null) {
            addWords(ret, line);
        }
        return ret;
    }

    /**
     * Adds the whitespace separated words of <code>s</code>; blanks are
     * skipped.
     */
    static void addWords(List<String> terms, String s) {
        for (String word : s.trim().split("\\s+")) {
            if (word.length() != 0) {
                terms.add(word);
            }
        }
    }
}
