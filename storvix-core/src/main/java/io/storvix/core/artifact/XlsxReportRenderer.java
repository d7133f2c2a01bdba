package io.storvix.core.artifact;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

final class XlsxReportRenderer {

    byte[] render(ReportDocument report) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Report");
            Font boldFont = workbook.createFont();
            boldFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFont(boldFont);

            int rowIndex = 0;
            Row title = sheet.createRow(rowIndex++);
            Cell titleCell = title.createCell(0);
            titleCell.setCellValue(report.title());
            titleCell.setCellStyle(headerStyle);
            sheet.createRow(rowIndex++).createCell(0)
                .setCellValue("Generated at " + DateTimeFormatter.ISO_INSTANT.format(report.generatedAt()));
            if (!report.sections().isEmpty()) {
                sheet.createRow(rowIndex++).createCell(0)
                    .setCellValue("Sections included: " + String.join(", ", report.sections()));
            }
            rowIndex++;

            Row header = sheet.createRow(rowIndex++);
            for (int i = 0; i < report.headers().size(); i++) {
                Cell cell = header.createCell(i);
                cell.setCellValue(report.headers().get(i));
                cell.setCellStyle(headerStyle);
            }
            for (List<String> values : report.rows()) {
                Row row = sheet.createRow(rowIndex++);
                for (int i = 0; i < values.size(); i++) {
                    row.createCell(i).setCellValue(values.get(i));
                }
            }
            for (int i = 0; i < report.headers().size(); i++) {
                sheet.setColumnWidth(i, 18 * 256);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            return out.toByteArray();
        }
    }
}
