package backend;

import backend.register.RegisterManager;
import midend.analysis.SethiUllmanLabeler;
import midend.dag.Node;
import midend.dag.OperationDAG;

import java.util.ArrayList;
import java.util.List;

public class CodeGenerator {
    private OperationDAG dag;
    private int tempCounter = 0;
    private ArrayList<String> code;
    private ArrayList<String> trace;
    private RegisterManager registers;

    public Result generate(OperationDAG dag, Node root) {
        this.dag = dag;
        this.tempCounter = 0;
        this.code = new ArrayList<>();
        this.trace = new ArrayList<>();
        this.registers = new RegisterManager();
        if (root == null) {
            return new Result(code, trace, 0, 0);
        }
        if (!root.isLabeled()) {
            new SethiUllmanLabeler().label(dag, root);
        }
        emitThreeAddress(root);
        Operand res = evaluate(root);
        return new Result(code, trace, registers.getPeak(), res.isRegister() ? res.reg : 0);
    }

    public Result generate(OperationDAG dag) {
        return generate(dag, dag.getRoot());
    }

    private String newTemp() {
        return "t" + ++tempCounter;
    }

    private String emitThreeAddress(Node node) {
        if (node.getChildNum() == 0) {
            return node.getValue();
        }
        if (node.getChildNum() == 1) {
            String operand = emitThreeAddress(dag.getNode(node.getChild(0)));
            String temp = newTemp();
            code.add(temp + " = " + node.getValue() + " " + operand);
            return temp;
        }
        String lhs = emitThreeAddress(dag.getNode(node.getChild(0)));
        String rhs = emitThreeAddress(dag.getNode(node.getChild(1)));
        String temp = newTemp();
        code.add(temp + " = " + lhs + " " + node.getValue() + " " + rhs);
        return temp;
    }

    private Operand evaluate(Node node) {
        switch (node.getChildNum()) {
            case 0:
                return evaluateLeaf(node, node.getLabel() > 0);
            case 1:
                return evaluateUnary(node);
            case 2:
                return evaluateBinary(node);
            default:
                throw new RuntimeException("operation " + node + " has " + node.getChildNum() + " operands");
        }
    }

    private Operand evaluateLeaf(Node node, boolean load) {
        if (!load) {
            return Operand.memory(node.getValue());
        }
        int reg = registers.acquire();
        trace.add("Load " + node.getValue() + " into " + RegisterManager.getName(reg));
        return Operand.register(reg);
    }

    private Operand evaluateUnary(Node node) {
        Node child = dag.getNode(node.getChild(0));
        Operand operand = child.getChildNum() == 0 ? evaluateLeaf(child, true) : evaluate(child);
        String name = RegisterManager.getName(operand.reg);
        trace.add("Compute " + node.getValue() + name + " -> " + name);
        return operand;
    }

    private Operand evaluateBinary(Node node) {
        Node lhs = dag.getNode(node.getChild(0));
        Node rhs = dag.getNode(node.getChild(1));
        Operand left;
        Operand right;
        if (lhs.getLabel() < rhs.getLabel()) {
            right = evaluate(rhs);
            left = evaluate(lhs);
        } else {
            left = evaluate(lhs);
            right = evaluate(rhs);
        }
        if (!left.isRegister()) {
            // stale labels can leave a memory operand on the left
            int reg = registers.acquire();
            trace.add("Load " + left.name + " into " + RegisterManager.getName(reg));
            left = Operand.register(reg);
        }
        String target = RegisterManager.getName(left.reg);
        trace.add("Compute " + target + " " + node.getValue() + " " + right + " -> " + target);
        if (right.isRegister()) {
            registers.release(right.reg);
            trace.add("Release " + right);
        }
        return left;
    }

    private static class Operand {
        private final int reg;
        private final String name;

        private Operand(int reg, String name) {
            this.reg = reg;
            this.name = name;
        }

        static Operand register(int reg) {
            return new Operand(reg, null);
        }

        static Operand memory(String name) {
            return new Operand(0, name);
        }

        boolean isRegister() {
            return name == null;
        }

        @Override
        public String toString() {
            return isRegister() ? RegisterManager.getName(reg) : name;
        }
    }

    public static class Result {
        private final List<String> threeAddressCode;
        private final List<String> registerTrace;
        private final int peakRegisters;
        private final int resultRegister;

        public Result(List<String> threeAddressCode, List<String> registerTrace, int peakRegisters, int resultRegister) {
            this.threeAddressCode = threeAddressCode;
            this.registerTrace = registerTrace;
            this.peakRegisters = peakRegisters;
            this.resultRegister = resultRegister;
        }

        public List<String> getThreeAddressCode() {
            return threeAddressCode;
        }

        public List<String> getRegisterTrace() {
            return registerTrace;
        }

        public int getPeakRegisters() {
            return peakRegisters;
        }

        /**
         * Number of the symbolic register holding the value of the whole expression.
         */
        public int getResultRegister() {
            return resultRegister;
        }
    }
}
