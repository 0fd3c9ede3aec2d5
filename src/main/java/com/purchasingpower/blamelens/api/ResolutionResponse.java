package com.purchasingpower.blamelens.api;

import com.purchasingpower.blamelens.model.blame.LineAttribution;
import com.purchasingpower.blamelens.model.vcs.ChangeRequest;
import com.purchasingpower.blamelens.model.vcs.LineResolution;
import com.purchasingpower.blamelens.model.vcs.ResolutionOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Attribution and change request of one file line.
 *
 * {@code loading} means the lookup is still running; ask again shortly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionResponse {

    private boolean success;
    private String file;
    private int line;

    private String commitId;
    private String author;
    private String authorEmail;
    private Instant timestamp;
    private String summary;

    private boolean checked;
    private boolean loading;
    private ChangeRequest changeRequest;

    private String error;

    public static ResolutionResponse of(String file, int line, LineResolution resolution) {
        ResolutionOutcome outcome = resolution.getOutcome();
        ResolutionResponseBuilder builder = ResolutionResponse.builder()
                .success(true)
                .file(file)
                .line(line)
                .checked(outcome.isChecked())
                .loading(outcome.isLoading())
                .changeRequest(outcome.getChangeRequest());

        LineAttribution attribution = resolution.getAttribution();
        if (attribution != null) {
            builder.commitId(attribution.getCommitId())
                    .author(attribution.getAuthor())
                    .authorEmail(attribution.getAuthorEmail())
                    .timestamp(attribution.getTimestamp())
                    .summary(attribution.getSummary());
        }
        return builder.build();
    }

    public static ResolutionResponse loading(String file, int line) {
        return ResolutionResponse.builder()
                .success(true)
                .file(file)
                .line(line)
                .loading(true)
                .build();
    }

    public static ResolutionResponse error(String error) {
        return ResolutionResponse.builder()
                .success(false)
                .error(error)
                .build();
    }
}
