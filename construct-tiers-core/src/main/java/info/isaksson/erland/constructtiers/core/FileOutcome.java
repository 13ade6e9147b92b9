package info.isaksson.erland.constructtiers.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.constructtiers.report.FileReport;

import java.util.Objects;

/** Result for one file: a report or an error, never both. */
@JsonPropertyOrder({"file","report","error"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FileOutcome {
    public final String file;
    public final FileReport report;
    public final ClassificationError error;

    @JsonCreator
    public FileOutcome(
            @JsonProperty("file") String file,
            @JsonProperty("report") FileReport report,
            @JsonProperty("error") ClassificationError error
    ) {
        if ((report == null) == (error == null)) {
            throw new IllegalArgumentException("outcome for " + file + " needs exactly one of report and error");
        }
        this.file = file;
        this.report = report;
        this.error = error;
    }

    public static FileOutcome success(FileReport report) {
        if (report == null) throw new IllegalArgumentException("report must not be null");
        return new FileOutcome(report.file, report, null);
    }

    public static FileOutcome failure(ClassificationError error) {
        if (error == null) throw new IllegalArgumentException("error must not be null");
        return new FileOutcome(error.file, null, error);
    }

    public boolean succeeded() {
        return report != null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileOutcome)) return false;
        FileOutcome that = (FileOutcome) o;
        return Objects.equals(file, that.file) &&
                Objects.equals(report, that.report) &&
                Objects.equals(error, that.error);
    }

    @Override public int hashCode() {
        return Objects.hash(file, report, error);
    }

    @Override public String toString() {
        return succeeded() ? report.toString() : error.toString();
    }
}
