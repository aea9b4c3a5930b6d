package backend.register;

import java.util.TreeSet;

/**
 * Pool of symbolic registers {@code R1, R2, ...} for the evaluation trace. Acquire hands out the
 * lowest free number.
 */
public class RegisterManager {
    private final TreeSet<Integer> live = new TreeSet<>();
    private int peak = 0;

    public int acquire() {
        int reg = 1;
        while (live.contains(reg)) {
            ++reg;
        }
        live.add(reg);
        peak = Math.max(peak, live.size());
        return reg;
    }

    public void release(int reg) {
        if (!live.remove(reg)) {
            throw new RuntimeException("release of R" + reg + " which is not live");
        }
    }

    public boolean isLive(int reg) {
        return live.contains(reg);
    }

    public int getLiveNum() {
        return live.size();
    }

    public int getPeak() {
        return peak;
    }

    public static String getName(int reg) {
        return "R" + reg;
    }
}
