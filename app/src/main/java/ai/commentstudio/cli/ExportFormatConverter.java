package ai.commentstudio.cli;

import ai.commentstudio.export.ExportFormat;
import picocli.CommandLine;

public class ExportFormatConverter implements CommandLine.ITypeConverter<ExportFormat> {
    @Override
    public ExportFormat convert(String value) {
        return ExportFormat.from(value);
    }
}
