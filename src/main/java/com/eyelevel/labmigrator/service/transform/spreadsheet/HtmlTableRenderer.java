package com.eyelevel.labmigrator.service.transform.spreadsheet;

import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the leading rows of a grid as an inline HTML table for the experiment body.
 */
@Component
public class HtmlTableRenderer {

    public String renderPreview(SheetGrid grid, int maxRows) {
        List<List<String>> rows = grid.rows();
        int shown = Math.min(Math.max(maxRows, 0), rows.size());
        int columns = grid.columnCount();
        StringBuilder html = new StringBuilder("<table>");
        for (int i = 0; i < shown; i++) {
            List<String> row = rows.get(i);
            html.append("<tr>");
            for (int j = 0; j < columns; j++) {
                String cell = j < row.size() && row.get(j) != null ? row.get(j) : "";
                html.append("<td>").append(Entities.escape(cell)).append("</td>");
            }
            html.append("</tr>");
        }
        html.append("</table>");
        if (rows.size() > shown) {
            html.append("<p><em>").append(rows.size() - shown).append(" more row(s) in the attachment.</em></p>");
        }
        return html.toString();
    }
}
