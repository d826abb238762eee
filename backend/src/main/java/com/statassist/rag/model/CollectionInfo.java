package com.statassist.rag.model;

import lombok.Value;

import java.util.Map;

/**
 * Name, chunk count and creation metadata of an indexed session.
 */
@Value
public class CollectionInfo {

    String name;

    int count;

    Map<String, ContextValue> metadata;
}
