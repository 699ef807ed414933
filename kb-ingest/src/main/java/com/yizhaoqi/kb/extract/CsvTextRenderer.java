package com.yizhaoqi.kb.extract;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders comma separated text as "header: value" lines.
 * <p>
 * Lines are split on every comma. Quoted fields containing commas or line breaks are not
 * recognised and come out split.
 */
@Component
public class CsvTextRenderer {

    public RenderedTable render(String csv) {
        List<String[]> rows = new ArrayList<>();
        for (String line : csv.split("\n", -1)) {
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] cells = line.split(",", -1);
            for (int i = 0; i < cells.length; i++) {
                cells[i] = cells[i].trim();
            }
            rows.add(cells);
        }

        List<String> lines = new ArrayList<>();
        if (!rows.isEmpty()) {
            String[] headers = rows.get(0);
            lines.add("Headers: " + String.join(", ", headers));
            for (int r = 1; r < rows.size(); r++) {
                String[] row = rows.get(r);
                StringBuilder rendered = new StringBuilder();
                for (int c = 0; c < headers.length; c++) {
                    if (c > 0) {
                        rendered.append(", ");
                    }
                    rendered.append(headers[c]).append(": ").append(c < row.length ? row[c] : "");
                }
                lines.add(rendered.toString());
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rowCount", Math.max(0, rows.size() - 1));
        metadata.put("columnCount", rows.isEmpty() ? 0 : rows.get(0).length);
        return new RenderedTable(String.join("\n", lines), metadata);
    }

    public record RenderedTable(String text, Map<String, Object> metadata) {
    }
}
