package utils;

public class Config {
    public static final String inputFileName = "testfile.txt";
    public static final String errorOutputFileName = "error.txt";
    public static final String outputFileName = "output.txt";
    public static final String dagFileName = "dag.txt";
    public static final int maxExpressionLength = 1000;
    public static final boolean rearrange = true;
    public static final boolean emitDag = true;
    public static final int randomDagNodes = 10;
    public static final double randomDagEdgeProbability = 0.3;
    public static final long randomDagSeed = 42;
}
