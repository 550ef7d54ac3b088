package com.darwinlink.infrastructure.protocol;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Line syntax of the Darwin daemon.
 *
 * Inbound: {@code TAG;field1;field2;...}. Outbound: {@code VERB} or
 * {@code VERB arg1,arg2,...}. Stateless; safe from any thread.
 */
public final class WireCodec {

    public static final String FIELD_DELIMITER = ";";
    public static final String ARGUMENT_DELIMITER = ",";

    private WireCodec() {
    }

    /**
     * Encode a command as one line, without the line terminator.
     */
    public static String encode(Command command) {
        StringBuilder line = new StringBuilder(command.kind().verb());
        boolean first = true;
        for (FieldSpec spec : command.kind().params()) {
            Object value = command.params().get(spec.name());
            if (value == null) {
                continue;
            }
            line.append(first ? " " : ARGUMENT_DELIMITER).append(spec.type().format(value));
            first = false;
        }
        return line.toString();
    }

    /**
     * Decode one inbound line.
     *
     * @throws UnknownRecordKindException when the tag is not in {@link RecordKind}
     * @throws WireFormatException when the fields do not match the tag's schema
     */
    public static WireRecord decode(String line) {
        String text = stripLineEnd(line);
        if (text.isBlank()) {
            throw new WireFormatException(String.valueOf(line), "Empty line");
        }

        String[] parts = text.split(FIELD_DELIMITER, -1);
        String tag = parts[0].trim();
        RecordKind kind = RecordKind.fromTag(tag);
        if (kind == null) {
            throw new UnknownRecordKindException(line, tag);
        }

        List<FieldSpec> schema = kind.fields();
        for (int i = schema.size() + 1; i < parts.length; i++) {
            if (!parts[i].isBlank()) {
                throw new WireFormatException(line,
                    kind.tag() + " expects at most " + schema.size() + " fields, got " + (parts.length - 1));
            }
        }

        WireRecord.Builder builder = WireRecord.builder(kind);
        for (int i = 0; i < schema.size(); i++) {
            FieldSpec spec = schema.get(i);
            boolean supplied = i + 1 < parts.length;
            String raw = supplied ? parts[i + 1].trim() : "";
            if (raw.isEmpty()) {
                if (!spec.optional()) {
                    throw new WireFormatException(line,
                        (supplied ? "Empty" : "Missing") + " required field '" + spec.name() + "'");
                }
                continue;
            }
            try {
                builder.set(spec.name(), spec.type().parse(raw));
            } catch (RuntimeException e) {
                throw new WireFormatException(line,
                    "Field '" + spec.name() + "' is not a valid " + spec.type(), e);
            }
        }
        return builder.build();
    }

    /**
     * Parse a command line back into a {@link Command}.
     *
     * @throws WireFormatException for an unknown verb, wrong argument count
     *         or arguments that fail validation
     */
    public static Command decodeCommand(String line) {
        String text = stripLineEnd(line).trim();
        int space = text.indexOf(' ');
        String verb = space < 0 ? text : text.substring(0, space);
        CommandKind kind = CommandKind.fromVerb(verb);
        if (kind == null) {
            throw new WireFormatException(line, "Unknown command verb '" + verb + "'");
        }

        String[] args = space < 0 ? new String[0] : text.substring(space + 1).split(ARGUMENT_DELIMITER, -1);
        List<FieldSpec> specs = kind.params();
        if (args.length > specs.size()) {
            throw new WireFormatException(line, verb + " takes at most " + specs.size() + " arguments");
        }

        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String raw = args[i].trim();
            if (raw.isEmpty()) {
                continue;
            }
            FieldSpec spec = specs.get(i);
            try {
                params.put(spec.name(), spec.type().parse(raw));
            } catch (RuntimeException e) {
                throw new WireFormatException(line, "Argument '" + spec.name() + "' is not a valid " + spec.type(), e);
            }
        }
        try {
            return new Command(kind, params);
        } catch (CommandValidationException e) {
            throw new WireFormatException(line, e.getMessage(), e);
        }
    }

    private static String stripLineEnd(String line) {
        if (line == null) {
            return "";
        }
        String text = line;
        if (text.endsWith("\n")) {
            text = text.substring(0, text.length() - 1);
        }
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }
}
