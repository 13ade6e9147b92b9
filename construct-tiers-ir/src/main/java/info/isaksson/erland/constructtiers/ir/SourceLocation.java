package info.isaksson.erland.constructtiers.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.Objects;

/**
 * Source position of a node: file, start line/column and the end of the column span.
 *
 * <p>Lines and columns are 1-based. Any field may be null when the front end does not know it.</p>
 */
@JsonPropertyOrder({"file","line","col","endLine","endCol"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SourceLocation implements Comparable<SourceLocation> {

    /** Unknown positions sort after known ones. */
    public static final Comparator<SourceLocation> ORDER = Comparator.nullsLast(Comparator.<SourceLocation>naturalOrder());

    private static final Comparator<SourceLocation> NATURAL = Comparator
            .comparing((SourceLocation l) -> l.file, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(l -> l.line, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(l -> l.col, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(l -> l.endLine, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(l -> l.endCol, Comparator.nullsLast(Comparator.<Integer>naturalOrder()));

    public final String file;
    public final Integer line;
    public final Integer col;
    public final Integer endLine;
    public final Integer endCol;

    @JsonCreator
    public SourceLocation(
            @JsonProperty("file") String file,
            @JsonProperty("line") Integer line,
            @JsonProperty("col") Integer col,
            @JsonProperty("endLine") Integer endLine,
            @JsonProperty("endCol") Integer endCol
    ) {
        this.file = file;
        this.line = line;
        this.col = col;
        this.endLine = endLine;
        this.endCol = endCol;
    }

    public static SourceLocation at(String file, int line, int col) {
        return new SourceLocation(file, line, col, null, null);
    }

    public static SourceLocation span(String file, int line, int col, int endCol) {
        return new SourceLocation(file, line, col, line, endCol);
    }

    @Override
    public int compareTo(SourceLocation o) {
        return NATURAL.compare(this, o);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return Objects.equals(file, that.file) &&
                Objects.equals(line, that.line) &&
                Objects.equals(col, that.col) &&
                Objects.equals(endLine, that.endLine) &&
                Objects.equals(endCol, that.endCol);
    }

    @Override public int hashCode() {
        return Objects.hash(file, line, col, endLine, endCol);
    }

    /** {@code file:line:col}, with {@code ?} for unknown parts. */
    @Override public String toString() {
        return (file == null ? "?" : file) + ":" + (line == null ? "?" : line) + ":" + (col == null ? "?" : col);
    }
}
