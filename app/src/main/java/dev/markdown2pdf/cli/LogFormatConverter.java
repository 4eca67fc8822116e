package dev.markdown2pdf.cli;

import dev.markdown2pdf.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses the {@code --log-format} option, reporting unknown formats as a usage error.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
