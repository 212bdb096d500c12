package com.deepansh.billbot.llm;

import com.deepansh.billbot.model.Citation;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Input of one answer generation. {@code model} and {@code temperature} are
 * per-request overrides and may be null. Generation stops early once
 * {@code cancelled} reports true.
 */
public record AnswerRequest(String query,
                            List<Citation> citations,
                            String model,
                            Double temperature,
                            BooleanSupplier cancelled) {
}
