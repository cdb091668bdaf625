package com.instorm.scorecard.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.instorm.scorecard.config.LenientLocalDateDeserializer;

import java.time.LocalDate;
import java.util.List;

/**
 * One evaluation as returned by {@code GET /evaluations/my}. Only the fields the
 * dashboard reduces over are bound.
 *
 * An incomplete evaluation may carry no items.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationRecord(
    String id,
    @JsonDeserialize(using = LenientLocalDateDeserializer.class) LocalDate visitDate,
    List<EvaluationItem> items
) {

    public EvaluationRecord {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
