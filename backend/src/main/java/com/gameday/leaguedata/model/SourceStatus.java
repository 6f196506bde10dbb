package com.gameday.leaguedata.model;

/** Outcome of loading one sheet. UNAVAILABLE means the sheet failed, not that it had no rows. */
public enum SourceStatus { OK, EMPTY, UNAVAILABLE }
