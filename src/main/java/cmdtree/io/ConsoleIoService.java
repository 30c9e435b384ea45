package cmdtree.io;

import lombok.AllArgsConstructor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

@AllArgsConstructor
public final class ConsoleIoService implements IoService {
    private final BufferedReader in;

    private final PrintStream out;

    private final PrintStream err;

    public ConsoleIoService(final InputStream in, final PrintStream out, final PrintStream err) {
        this(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), out, err);
    }

    public ConsoleIoService() {
        this(System.in, System.out, System.err);
    }

    @Override
    public int readKey() throws IOException {
        return in.read();
    }

    @Override
    public String readLine() throws IOException {
        return in.readLine();
    }

    @Override
    public void write(final String value) {
        out.print(value == null ? "" : value);
        out.flush();
    }

    @Override
    public void writeLine(final String value) {
        out.println(value == null ? "" : value);
    }

    @Override
    public void writeError(final String value) {
        err.print(value);
        err.flush();
    }

    @Override
    public void writeErrorLine(final String value) {
        err.println(value);
    }
}
