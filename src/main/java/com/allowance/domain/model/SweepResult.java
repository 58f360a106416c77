package com.allowance.domain.model;

import lombok.Value;

@Value
public class SweepResult {

    int expired;
    int skipped;
    int failed;
    int purgedTrackers;
}
