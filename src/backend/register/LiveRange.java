package backend.register;

public class LiveRange implements Comparable<LiveRange> {
    private final int id;
    private final int start;
    private final int end;

    public LiveRange(int id, int start, int end) {
        if (end < start) {
            throw new RuntimeException("live range of node " + id + " ends before it starts");
        }
        this.id = id;
        this.start = start;
        this.end = end;
    }

    public int getId() {
        return id;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean overlaps(LiveRange o) {
        return !(end < o.start || start > o.end);
    }

    // by start level, then node id
    @Override
    public int compareTo(LiveRange o) {
        if (this.start == o.start) {
            return Integer.compare(this.id, o.id);
        }
        return Integer.compare(this.start, o.start);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LiveRange that = (LiveRange) o;
        return id == that.id && start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return (id * 31 + start) * 31 + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
