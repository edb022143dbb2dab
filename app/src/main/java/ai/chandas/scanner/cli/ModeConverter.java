package ai.chandas.scanner.cli;

import ai.chandas.scanner.config.Mode;
import picocli.CommandLine;

public class ModeConverter implements CommandLine.ITypeConverter<Mode> {

    @Override
    public Mode convert(String value) {
        try {
            return Mode.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
