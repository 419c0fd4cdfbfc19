package com.signalloop.controller.dto;

import com.signalloop.model.Candidate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.List;

public final class DecisionRequests {

    private DecisionRequests() {
    }

    public record CandidateBatchRequest(
            @NotEmpty(message = "candidates must not be empty")
            @Size(max = 500, message = "at most 500 candidates per request")
            List<@Valid CandidateInput> candidates
    ) {
        public List<Candidate> toCandidates() {
            return candidates.stream().map(CandidateInput::toCandidate).toList();
        }
    }

    public record CandidateInput(
            @NotBlank(message = "candidateId is required")
            String candidateId,

            String authorHandle,

            @Size(max = 4000, message = "text must be at most 4000 characters")
            String text,

            OffsetDateTime postedAt,

            @PositiveOrZero(message = "likeCount must be non-negative")
            Long likeCount,

            @PositiveOrZero(message = "replyCount must be non-negative")
            Long replyCount,

            @PositiveOrZero(message = "retweetCount must be non-negative")
            Long retweetCount,

            @PositiveOrZero(message = "views must be non-negative")
            Long views,

            @PositiveOrZero(message = "authorFollowers must be non-negative")
            Long authorFollowers,

            @DecimalMin(value = "0.0", message = "engagementRate must be non-negative")
            Double engagementRate,

            String strategyId,

            String strategyVersion
    ) {
        public Candidate toCandidate() {
            return new Candidate(candidateId, authorHandle, text, postedAt, likeCount, replyCount,
                    retweetCount, views, authorFollowers, engagementRate, strategyId, strategyVersion);
        }
    }
}
