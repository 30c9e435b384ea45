package cmdtree.io;

import java.io.IOException;

public interface IoService {
    /**
     * Reads one character, or -1 at end of input.
     */
    int readKey() throws IOException;

    /**
     * Reads one line without its terminator, or null at end of input.
     */
    String readLine() throws IOException;

    void write(String value);

    void writeLine(String value);

    default void writeLine() {
        writeLine("");
    }

    void writeError(String value);

    void writeErrorLine(String value);
}
