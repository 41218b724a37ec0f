package org.carball.sift.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import org.carball.sift.exception.SiftException;
import org.carball.sift.model.decision.SchemaDecision;
import org.carball.sift.model.index.IngestionKind;

import java.util.Map;

/**
 * Outcome of ingesting one upload, as reported back to the uploader.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionResult {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    private String status;
    private String filename;
    private IngestionKind kind;
    private String fileType;
    private String mimeType;
    private String categoryOrSchema;
    private String location;
    private Long indexId;
    private Map<String, Object> whatsInside;
    private SchemaDecision decision;
    private Integer recordsWritten;
    private String errorCode;
    private String error;

    public static IngestionResult failure(String filename, Exception e) {
        String code = e instanceof SiftException ? ((SiftException) e).getErrorCode() : e.getClass().getSimpleName();
        return IngestionResult.builder()
                .status(ERROR)
                .filename(filename)
                .errorCode(code)
                .error(e.getMessage())
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
