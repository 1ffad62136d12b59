package com.valuescreen.loader.ingest.parse;

import com.valuescreen.loader.ingest.model.ColumnarResponse;
import com.valuescreen.loader.ingest.model.DailyPriceRow;
import com.valuescreen.loader.ingest.model.FundamentalsRow;
import com.valuescreen.loader.ingest.model.IndexMembershipRow;
import com.valuescreen.loader.ingest.model.TickerRow;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts columnar datatable pages into typed rows. Rows without their natural key are dropped;
 * nothing here throws for a single malformed row.
 */
@Component
public class DatatableParser {

    public List<TickerRow> parseTickers(ColumnarResponse response) {
        ColumnIndex index = ColumnIndex.of(response.columns());
        List<TickerRow> rows = new ArrayList<>(response.data().size());
        for (List<Object> values : response.data()) {
            ColumnarRow row = new ColumnarRow(index, values);
            String ticker = ticker(row);
            if (ticker == null) {
                continue;
            }
            rows.add(new TickerRow(
                ticker,
                text(row, "name"),
                text(row, "exchange"),
                text(row, "sector"),
                text(row, "industry"),
                text(row, "scalerevenue"),
                row.bool("isdelisted"),
                row.date("lastupdated")
            ));
        }
        return rows;
    }

    public List<FundamentalsRow> parseFundamentals(ColumnarResponse response) {
        ColumnIndex index = ColumnIndex.of(response.columns());
        List<FundamentalsRow> rows = new ArrayList<>(response.data().size());
        for (List<Object> values : response.data()) {
            ColumnarRow row = new ColumnarRow(index, values);
            LocalDate dateKey = row.date("datekey");
            String ticker = ticker(row);
            String dimension = text(row, "dimension");
            if (dateKey == null || ticker == null || dimension == null) {
                continue;
            }
            LocalDate calendarDate = row.date("calendardate");
            LocalDate reportPeriod = row.date("reportperiod");
            rows.add(new FundamentalsRow(
                ticker,
                dimension.toUpperCase(Locale.ROOT),
                calendarDate == null ? dateKey : calendarDate,
                dateKey,
                reportPeriod == null ? dateKey : reportPeriod,
                row.date("lastupdated"),
                row.decimal("revenue"),
                row.decimal("netinc"),
                row.decimal("ebitda"),
                row.decimal("fcf"),
                row.decimal("roic"),
                row.decimal("pe"),
                row.decimal("evebit"),
                row.decimal("pb"),
                row.decimal("de"),
                row.decimal("marketcap"),
                row.decimal("ev"),
                row.decimal("price")
            ));
        }
        return rows;
    }

    public List<DailyPriceRow> parseDailyPrices(ColumnarResponse response) {
        ColumnIndex index = ColumnIndex.of(response.columns());
        List<DailyPriceRow> rows = new ArrayList<>(response.data().size());
        for (List<Object> values : response.data()) {
            ColumnarRow row = new ColumnarRow(index, values);
            LocalDate date = row.date("date");
            String ticker = ticker(row);
            if (date == null || ticker == null) {
                continue;
            }
            rows.add(new DailyPriceRow(
                ticker,
                date,
                row.decimal("open"),
                row.decimal("high"),
                row.decimal("low"),
                row.decimal("close"),
                row.longValue("volume"),
                row.decimal("dividends"),
                row.decimal("closeunadj"),
                row.decimal("marketcap"),
                row.decimal("ev"),
                row.decimal("pe"),
                row.decimal("pb"),
                row.date("lastupdated")
            ));
        }
        return rows;
    }

    public List<IndexMembershipRow> parseIndexMembership(ColumnarResponse response) {
        ColumnIndex index = ColumnIndex.of(response.columns());
        List<IndexMembershipRow> rows = new ArrayList<>(response.data().size());
        for (List<Object> values : response.data()) {
            ColumnarRow row = new ColumnarRow(index, values);
            LocalDate date = row.date("date");
            String ticker = ticker(row);
            String action = text(row, "action");
            if (date == null || ticker == null || action == null) {
                continue;
            }
            rows.add(new IndexMembershipRow(
                date,
                action.toLowerCase(Locale.ROOT),
                ticker,
                text(row, "name"),
                firstText(row, "contraticker", "conticker"),
                firstText(row, "contraname", "conname")
            ));
        }
        return rows;
    }

    private static String ticker(ColumnarRow row) {
        String ticker = text(row, "ticker");
        return ticker == null ? null : ticker.toUpperCase(Locale.ROOT);
    }

    private static String text(ColumnarRow row, String column) {
        String value = row.string(column);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String firstText(ColumnarRow row, String... columns) {
        for (String column : columns) {
            String value = text(row, column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
