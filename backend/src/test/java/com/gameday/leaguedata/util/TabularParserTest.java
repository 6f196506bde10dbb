package com.gameday.leaguedata.util;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class TabularParserTest {

    @Test
    void splitsOnCommasAndTrimsCells() {
        List<List<String>> rows = TabularParser.parse("a, b ,c\n1,2,3\n");
        assertThat(rows).containsExactly(List.of("a", "b", "c"), List.of("1", "2", "3"));
    }

    @Test
    void keepsCommasInsideQuotesAndDropsTheQuotes() {
        List<List<String>> rows = TabularParser.parse("\"Smith, John\",12,\"x\"");
        assertThat(rows).containsExactly(List.of("Smith, John", "12", "x"));
    }

    @Test
    void skipsBlankLinesAndCarriageReturns() {
        List<List<String>> rows = TabularParser.parse("a,b\r\n\r\n   \r\nc,d\r\n");
        assertThat(rows).containsExactly(List.of("a", "b"), List.of("c", "d"));
    }

    @Test
    void keepsEmptyCells() {
        assertThat(TabularParser.parse(",x,")).containsExactly(List.of("", "x", ""));
    }

    @Test
    void unterminatedQuoteQuotesTheRestOfTheLine() {
        List<List<String>> rows = TabularParser.parse("a,\"b,c\nd,e");
        assertThat(rows).containsExactly(List.of("a", "b,c"), List.of("d", "e"));
    }

    @Test
    void nullOrEmptyInputGivesNoRows() {
        assertThat(TabularParser.parse(null)).isEmpty();
        assertThat(TabularParser.parse("")).isEmpty();
        assertThat(TabularParser.parse("\n\n")).isEmpty();
    }

    @Test
    void neverFailsOnArbitraryText() {
        Random random = new Random(42);
        String alphabet = "ab,\"\r\n \t;'x";
        for (int i = 0; i < 500; i++) {
            StringBuilder text = new StringBuilder();
            int len = random.nextInt(60);
            for (int j = 0; j < len; j++) text.append(alphabet.charAt(random.nextInt(alphabet.length())));
            assertThat(TabularParser.parse(text.toString())).allSatisfy(row -> assertThat(row).isNotEmpty());
        }
    }

    @Test
    void readsWhatAStandardCsvWriterProduces() throws IOException {
        List<List<String>> table = List.of(
                List.of("First Name", "Last Name", "Team", "Division"),
                List.of("Jo", "Park", "Rockets", "East, North"),
                List.of("Sam", "Lee", "Comets", "West South"));
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT)) {
            for (List<String> row : table) printer.printRecord(row);
        }

        assertThat(TabularParser.parse(out.toString())).isEqualTo(table);
    }
}
