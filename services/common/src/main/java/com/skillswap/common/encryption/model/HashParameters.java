package com.skillswap.common.encryption.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cost parameters recorded with a hash so it can be recomputed. Only the fields relevant to the
 * algorithm are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HashParameters {

    private Integer timeCost;
    private Integer memoryCost;
    private Integer parallelism;
    private Integer iterations;
    private Integer cost;
    private int hashSize;
    private boolean peppered;
}
