package com.di.retailstar.cleaning.rules;

import com.di.retailstar.cleaning.CleaningRule;
import com.di.retailstar.context.RunContext;
import com.di.retailstar.rowset.Columns;
import com.di.retailstar.rowset.Row;
import com.di.retailstar.rowset.RowSet;
import com.di.retailstar.util.TypeConverter;

import java.util.List;

/**
 * Trims country names and title-cases them: the first letter of every run of letters is
 * upper case, the rest lower case ({@code " united KINGDOM "} becomes {@code "United Kingdom"}).
 */
public class CountryNormalizationRule implements CleaningRule {

    @Override
    public String getRuleName() {
        return "country-normalization";
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(Columns.COUNTRY);
    }

    @Override
    public RowSet apply(RowSet rows, RunContext ctx) {
        for (Row row : rows) {
            String country = TypeConverter.toText(row.get(Columns.COUNTRY));
            row.set(Columns.COUNTRY, country == null ? null : titleCase(country.trim()));
        }
        return rows;
    }

    static String titleCase(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                sb.append(c);
                previousIsLetter = false;
            }
        }
        return sb.toString();
    }
}
