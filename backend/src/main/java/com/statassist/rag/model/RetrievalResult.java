package com.statassist.rag.model;

import lombok.Value;

import java.util.List;

/**
 * Ranked chunk texts, best first, together with the intent that ranked them.
 */
@Value
public class RetrievalResult {

    List<String> chunks;

    QueryIntent intent;
}
