package com.cardrewards.ingest.service;

import com.cardrewards.ingest.domain.CanonicalRow;
import com.cardrewards.ingest.exception.StatementParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CanonicalCsvParser Unit Tests")
class CanonicalCsvParserTest {

    private final CanonicalCsvParser parser = new CanonicalCsvParser();

    @Test
    @DisplayName("Should parse and trim canonical rows")
    void shouldParseAndTrimRows() {
        // Given
        String content = """
                transaction_date, description, amount, category, card
                2024-03-01,  STARBUCKS  , 4.5, Dining , amex\s
                2024-03-02,"AMAZON, INC",-19.99,,amex
                """;

        // When
        List<CanonicalRow> rows = parser.parse(content);

        // Then
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).isEqualTo(new CanonicalRow(
                LocalDate.of(2024, 3, 1), "STARBUCKS", new BigDecimal("4.50"), "Dining", "amex"));
        assertThat(rows.get(1).description()).isEqualTo("AMAZON, INC");
        assertThat(rows.get(1).amount()).isEqualTo(new BigDecimal("-19.99"));
        assertThat(rows.get(1).category()).isNull();
        assertThat(rows.get(1).hasCategory()).isFalse();
    }

    @Test
    @DisplayName("Should map columns by header name regardless of order and case")
    void shouldMapColumnsByHeaderName() {
        String content = "Card,Amount,Transaction_Date,Category,Description\namex,10,2024-03-05,Travel,UBER\n";

        List<CanonicalRow> rows = parser.parse(content);

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.card()).isEqualTo("amex");
            assertThat(row.amount()).isEqualTo(new BigDecimal("10.00"));
            assertThat(row.transactionDate()).isEqualTo(LocalDate.of(2024, 3, 5));
            assertThat(row.description()).isEqualTo("UBER");
        });
    }

    @Test
    @DisplayName("Should skip blank lines")
    void shouldSkipBlankLines() {
        String content = "transaction_date,description,amount,category,card\n\n2024-03-01,A,1.00,X,amex\n\n";

        assertThat(parser.parse(content)).hasSize(1);
    }

    @Test
    @DisplayName("Should fail the statement on a non-ISO date")
    void shouldFailOnBadDate() {
        String content = "transaction_date,description,amount,category,card\n"
                + "2024-03-01,A,1.00,X,amex\n"
                + "03/02/2024,B,2.00,X,amex\n";

        assertThatThrownBy(() -> parser.parse(content))
                .isInstanceOf(StatementParseException.class)
                .hasMessageContaining("record 2")
                .hasMessageContaining("03/02/2024");
    }

    @Test
    @DisplayName("Should fail the statement on a non-numeric amount")
    void shouldFailOnBadAmount() {
        String content = "transaction_date,description,amount,category,card\n2024-03-01,A,$1.00,X,amex\n";

        assertThatThrownBy(() -> parser.parse(content))
                .isInstanceOf(StatementParseException.class)
                .hasMessageContaining("invalid amount '$1.00'")
                .extracting(ex -> ((StatementParseException) ex).getRecordNumber())
                .isEqualTo(1L);
    }

    @Test
    @DisplayName("Should reject amounts with more than two decimal places instead of rounding them")
    void shouldRejectSubCentAmount() {
        String content = "transaction_date,description,amount,category,card\n2024-03-01,X,5.499,D,amex\n";

        assertThatThrownBy(() -> parser.parse(content))
                .isInstanceOf(StatementParseException.class)
                .hasMessageContaining("amount '5.499' has more than 2 decimal places")
                .extracting(ex -> ((StatementParseException) ex).getRecordNumber())
                .isEqualTo(1L);
    }

    @Test
    @DisplayName("Should accept trailing zeros beyond two decimal places")
    void shouldAcceptTrailingZeros() {
        String content = "transaction_date,description,amount,category,card\n2024-03-01,X,5.4900,D,amex\n";

        List<CanonicalRow> rows = parser.parse(content);

        assertThat(rows.get(0).amount()).isEqualTo(new BigDecimal("5.49"));
    }

    @Test
    @DisplayName("Should fail when a required value is blank")
    void shouldFailOnBlankCard() {
        String content = "transaction_date,description,amount,category,card\n2024-03-01,A,1.00,X,\n";

        assertThatThrownBy(() -> parser.parse(content))
                .isInstanceOf(StatementParseException.class)
                .hasMessageContaining("card is required");
    }

    @Test
    @DisplayName("Should fail when a row is shorter than the header")
    void shouldFailOnShortRow() {
        String content = "transaction_date,description,amount,category,card\n2024-03-01,A\n";

        assertThatThrownBy(() -> parser.parse(content))
                .isInstanceOf(StatementParseException.class)
                .hasMessageContaining("missing");
    }
}
