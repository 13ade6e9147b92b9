package info.isaksson.erland.constructtiers.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.constructtiers.classify.ClassificationException;
import info.isaksson.erland.constructtiers.ir.SourceLocation;

import java.util.Objects;

/** Why one file produced no report. */
@JsonPropertyOrder({"file","code","message","nodeId","location"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ClassificationError {
    public final String file;

    /** One of the {@code CODE} constants of the {@link ClassificationException} subclasses. */
    public final String code;

    public final String message;
    public final Integer nodeId;
    public final SourceLocation location;

    @JsonCreator
    public ClassificationError(
            @JsonProperty("file") String file,
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("nodeId") Integer nodeId,
            @JsonProperty("location") SourceLocation location
    ) {
        this.file = file;
        this.code = code;
        this.message = message;
        this.nodeId = nodeId;
        this.location = location;
    }

    public static ClassificationError of(ClassificationException e) {
        if (e == null) throw new IllegalArgumentException("exception must not be null");
        return new ClassificationError(e.file, e.code, e.getMessage(), e.nodeId, e.location);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassificationError)) return false;
        ClassificationError that = (ClassificationError) o;
        return Objects.equals(file, that.file) &&
                Objects.equals(code, that.code) &&
                Objects.equals(message, that.message) &&
                Objects.equals(nodeId, that.nodeId) &&
                Objects.equals(location, that.location);
    }

    @Override public int hashCode() {
        return Objects.hash(file, code, message, nodeId, location);
    }

    @Override public String toString() {
        return file + ": " + code + " " + message;
    }
}
