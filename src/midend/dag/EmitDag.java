package midend.dag;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Text form of the node and edge export, one {@code node} or {@code edge} line each. Nodes are
 * annotated with their register when an assignment is given, otherwise with their label.
 */
public class EmitDag {
    private final String outPath;

    public EmitDag(String outPath) {
        this.outPath = outPath;
    }

    public static String render(OperationDAG dag, Map<Integer, Integer> registers) {
        StringBuilder sb = new StringBuilder();
        for (OperationDAG.ExportedNode node : dag.exportNodes()) {
            sb.append("node ").append(node.getId())
                    .append(" \"").append(node.getDisplayLabel()).append("\" ")
                    .append(node.getCategory());
            if (registers != null && registers.containsKey(node.getId())) {
                sb.append(" R").append(registers.get(node.getId()));
            } else if (dag.getNode(node.getId()).isLabeled()) {
                sb.append(" label=").append(dag.getNode(node.getId()).getLabel());
            }
            sb.append("\n");
        }
        for (OperationDAG.ExportedEdge edge : dag.exportEdges()) {
            sb.append("edge ").append(edge.getFrom()).append(" ").append(edge.getTo()).append("\n");
        }
        return sb.toString();
    }

    public void run(OperationDAG dag, Map<Integer, Integer> registers) throws IOException {
        try (Writer writer = new OutputStreamWriter(new FileOutputStream(outPath), StandardCharsets.UTF_8)) {
            writer.write(render(dag, registers));
        }
    }
}
