package com.allowance.domain.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A parent's decision on a pending spending request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RespondInput {

    private boolean approved;

    @NotNull
    private UUID respondedBy;

    @Size(max = 1000)
    private String comment;

    private boolean learningMoment;
}
