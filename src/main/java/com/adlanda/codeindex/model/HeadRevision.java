package com.adlanda.codeindex.model;

/**
 * A resolved branch and the commit at its tip.
 */
public record HeadRevision(String branch, String sha) {}
