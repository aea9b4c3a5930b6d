package midend.pass;

import static org.junit.Assert.*;

import backend.CodeGenerator;
import frontend.ExpressionParser;
import midend.analysis.SethiUllmanLabeler;
import midend.dag.Node;
import midend.dag.OperationDAG;
import org.junit.Test;
import utils.RandomExpressions;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

public class DAGRearrangerTest {

    private static OperationDAG parse(String text) {
        return new ExpressionParser().parse(text).getOrThrow();
    }

    private static String shape(OperationDAG dag, Node node) {
        if (node.getChildNum() == 0) {
            return node.getValue();
        }
        return "(" + shape(dag, dag.getNode(node.getChild(0))) + node.getValue()
                + shape(dag, dag.getNode(node.getChild(1))) + ")";
    }

    @Test
    public void testSubtractionIsLeftAlone() {
        OperationDAG dag = parse("(a+b)-(c+d)");
        DAGRearranger rearranger = new DAGRearranger();
        Node root = rearranger.rearrange(dag);
        assertEquals("((a+b)-(c+d))", shape(dag, root));
        assertEquals(2, root.getLabel());
        assertEquals(0, rearranger.getRewriteCount());
    }

    @Test
    public void testNonCommutativeOperandsNeverSwapped() {
        OperationDAG dag = parse("a-(b*c+d*e)");
        Node root = new DAGRearranger().rearrange(dag);
        assertEquals("a", dag.getNode(root.getChild(0)).getValue());

        dag = parse("a/(b*c+d*e)");
        root = new DAGRearranger().rearrange(dag);
        assertEquals("a", dag.getNode(root.getChild(0)).getValue());
    }

    @Test
    public void testHeavierOperandMovesLeft() {
        OperationDAG dag = parse("a+(b*c+d*e)");
        DAGRearranger rearranger = new DAGRearranger();
        Node root = rearranger.rearrange(dag);
        // the swap exposes a same-operator left operand, which is then regrouped
        assertEquals("((b*c)+((d*e)+a))", shape(dag, root));
        assertEquals(2, root.getLabel());
        assertEquals(2, rearranger.getRewriteCount());
    }

    @Test
    public void testSwapWithoutRegroup() {
        OperationDAG dag = parse("a*(b+c*d)");
        DAGRearranger rearranger = new DAGRearranger();
        Node root = rearranger.rearrange(dag);
        assertEquals("((b+(c*d))*a)", shape(dag, root));
        assertEquals(1, rearranger.getRewriteCount());
        assertEquals(0, dag.getNode(root.getChild(1)).getLabel());
    }

    @Test
    public void testRegroupThroughLeftOperand() {
        OperationDAG dag = parse("(a*b+c*d)+e");
        int before = new SethiUllmanLabeler().label(dag);
        int nodesBefore = dag.size();
        DAGRearranger rearranger = new DAGRearranger();
        Node root = rearranger.rearrange(dag);
        assertEquals("((a*b)+((c*d)+e))", shape(dag, root));
        assertEquals(1, rearranger.getRewriteCount());
        assertTrue(root.getLabel() <= before);
        // the regrouped node is new, the old left operand stays in the arena unreferenced
        assertEquals(nodesBefore + 1, dag.size());
        assertEquals(dag.reachableFromRoot().size(), nodesBefore);

        CodeGenerator.Result code = new CodeGenerator().generate(dag, root);
        assertEquals(List.of("t1 = a * b", "t2 = c * d", "t3 = t2 + e", "t4 = t1 + t3"), code.getThreeAddressCode());
    }

    @Test
    public void testLeftAssociatedSumKeepsItsLabel() {
        OperationDAG dag = parse("(a+b)+c");
        int before = new SethiUllmanLabeler().label(dag);
        Node root = new DAGRearranger().rearrange(dag);
        assertEquals(before, root.getLabel());
    }

    @Test
    public void testRightNestedSumIsNotRegrouped() {
        // regrouping only looks through the left operand, so a+(b+c) keeps label 2 although
        // (b+c)+a would need a single register
        OperationDAG dag = parse("a+(b+c)");
        Node root = new DAGRearranger().rearrange(dag);
        assertEquals("(a+(b+c))", shape(dag, root));
        assertEquals(2, root.getLabel());
        assertEquals(1, new SethiUllmanLabeler().label(parse("(b+c)+a")));
    }

    @Test
    public void testNeverIncreasesLabelAndPreservesValue() {
        Random random = new Random(2024);
        Map<String, Long> env = new HashMap<>();
        for (int i = 0; i < RandomExpressions.VARIABLES.length(); ++i) {
            env.put(String.valueOf(RandomExpressions.VARIABLES.charAt(i)), (long) (i * 7 - 11));
        }
        SethiUllmanLabeler labeler = new SethiUllmanLabeler();
        for (int i = 0; i < 300; ++i) {
            String text = RandomExpressions.generate(random, 6, "+-*");
            OperationDAG dag = parse(text);
            int before = labeler.label(dag);
            long value = RandomExpressions.evaluate(dag, dag.getRoot(), env);
            Node root = new DAGRearranger().rearrange(dag);
            assertTrue(text, root.getLabel() <= before);
            assertEquals(text, value, RandomExpressions.evaluate(dag, root, env));
            assertEquals(root.getLabel(), labeler.label(dag, root));
        }
    }

    @Test
    public void testSubtractionAndDivisionOrderSurvives() {
        Random random = new Random(99);
        for (int i = 0; i < 100; ++i) {
            OperationDAG dag = parse(RandomExpressions.generate(random, 5, "+-*/"));
            Map<Integer, List<Integer>> before = new HashMap<>();
            for (Node node : dag.getNodes()) {
                if (node.getValue().equals("-") || node.getValue().equals("/")) {
                    before.put(node.getId(), List.copyOf(node.getChildren()));
                }
            }
            new DAGRearranger().rearrange(dag);
            for (Map.Entry<Integer, List<Integer>> e : before.entrySet()) {
                assertEquals(e.getValue(), dag.getNode(e.getKey()).getChildren());
            }
        }
    }
}
