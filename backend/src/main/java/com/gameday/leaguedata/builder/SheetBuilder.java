package com.gameday.leaguedata.builder;

import java.util.List;

/**
 * Maps the parsed rows of one sheet to entity records. Implementations are stateless:
 * the same rows always give the same records, and a bad row is skipped rather than
 * failing the whole sheet.
 */
public interface SheetBuilder<T> {

    List<T> build(List<List<String>> rows);
}
