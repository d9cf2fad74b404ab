package com.flagship.financial_model.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.financial_model.ledger.LedgerRecord;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * One ledger row as posted by clients.
 *
 * Dates are parsed leniently: ISO dates, ISO date-times, yyyy/MM/dd and
 * MM/dd/yyyy are accepted; anything else becomes an undated record that
 * the validator reports and the aggregator drops.
 */
@Value
@Builder
@Jacksonized
public class LedgerRecordRequest {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("yyyy/MM/dd"),
        DateTimeFormatter.ofPattern("MM/dd/yyyy")
    );

    @JsonProperty("txn_date")
    String txnDate;

    @JsonProperty("account_number")
    Integer accountNumber;

    @JsonProperty("account_name")
    String accountName;

    @PositiveOrZero(message = "Debit must not be negative")
    @JsonProperty("debit")
    BigDecimal debit;

    @PositiveOrZero(message = "Credit must not be negative")
    @JsonProperty("credit")
    BigDecimal credit;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("currency")
    String currency;

    public LedgerRecord toRecord() {
        return LedgerRecord.builder()
            .txnDate(parseDate(txnDate))
            .accountNumber(accountNumber)
            .accountName(accountName)
            .debit(debit)
            .credit(credit)
            .transactionId(transactionId)
            .currency(currency)
            .build();
    }

    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            Optional<LocalDate> parsed = tryParse(trimmed, format);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        return tryParse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE_TIME).orElse(null);
    }

    private static Optional<LocalDate> tryParse(String value, DateTimeFormatter format) {
        try {
            return Optional.of(format.parse(value, LocalDate::from));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static List<LedgerRecord> toRecords(List<LedgerRecordRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        return requests.stream().map(LedgerRecordRequest::toRecord).toList();
    }
}
