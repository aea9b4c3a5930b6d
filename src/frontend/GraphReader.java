package frontend;

import frontend.ErrorHandler.Error;
import midend.dag.OperationDAG;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads a dependency graph, one directive per line:
 * <pre>
 * node &lt;id&gt; [value]
 * edge &lt;from&gt; &lt;to&gt;
 * </pre>
 * Blank lines and lines starting with {@code #} are skipped. Acyclicity is checked later, by the
 * allocator.
 */
public class GraphReader {
    private final BufferedReader reader;
    private int line = 0;

    public GraphReader(InputStream is) {
        this.reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    public OperationDAG read() throws IOException {
        OperationDAG dag = new OperationDAG();
        String text;
        while ((text = reader.readLine()) != null) {
            ++line;
            String trimmed = text.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] parts = trimmed.split("\\s+");
            switch (parts[0]) {
                case "node": {
                    if (parts.length < 2 || parts.length > 3) {
                        throw malformed(trimmed, "expected 'node <id> [value]'");
                    }
                    dag.addNode(parseId(parts[1], trimmed), parts.length == 3 ? parts[2] : null);
                    break;
                }
                case "edge": {
                    if (parts.length != 3) {
                        throw malformed(trimmed, "expected 'edge <from> <to>'");
                    }
                    dag.addEdge(parseId(parts[1], trimmed), parseId(parts[2], trimmed));
                    break;
                }
                default:
                    throw malformed(trimmed, "unknown directive '" + parts[0] + "'");
            }
        }
        return dag;
    }

    private int parseId(String s, String context) {
        try {
            int id = Integer.parseInt(s);
            if (id < 0) {
                throw malformed(context, "negative node id " + s);
            }
            return id;
        } catch (NumberFormatException e) {
            throw malformed(context, "node id '" + s + "' is not an integer");
        }
    }

    private ErrorHandler.AnalysisException malformed(String context, String message) {
        return new ErrorHandler.AnalysisException(new Error(Error.ErrorType.SyntaxError, context,
                "line " + line + ": " + message));
    }
}
