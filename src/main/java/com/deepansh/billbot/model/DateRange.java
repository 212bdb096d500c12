package com.deepansh.billbot.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Inclusive date window, ISO-8601 dates (YYYY-MM-DD). */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DateRange {
    private String start;
    private String end;
}
