package com.declo.harness;

/**
 * One labelled pair from a corpus: the same transformation written as a
 * chain and as a comprehension.
 */
public record CorpusExample(String title, String chain, String comprehension) {}
