package com.ictskills.domain.model;

import lombok.Value;

@Value
public class TrendPoint {

    int year;
    double value;
}
