package com.darwinlink.infrastructure.protocol;

import java.util.EnumSet;
import java.util.Set;

/**
 * What a command expects back.
 *
 * The protocol has no request ids, so a response is recognised by kind and,
 * where the command carries one, by a shared field (order id, symbol).
 * correlationKey groups commands whose answers share record kinds: only one
 * request per key is in flight at a time.
 */
public record ResponseSpec(
    String correlationKey,
    Set<RecordKind> accepts,
    CollectionMode mode,
    String matchField
) {
    public ResponseSpec {
        accepts = Set.copyOf(accepts);
    }

    public static ResponseSpec single(String key, RecordKind first, RecordKind... rest) {
        return new ResponseSpec(key, EnumSet.of(first, rest), CollectionMode.SINGLE, null);
    }

    public static ResponseSpec list(String key, String matchField, RecordKind first, RecordKind... rest) {
        return new ResponseSpec(key, EnumSet.of(first, rest), CollectionMode.LIST, matchField);
    }

    public static ResponseSpec framed(String key, String matchField, RecordKind dataKind) {
        return new ResponseSpec(key, EnumSet.of(dataKind, RecordKind.BEGIN_DATA, RecordKind.END_DATA),
            CollectionMode.FRAMED, matchField);
    }

    static ResponseSpec orderAck() {
        return new ResponseSpec("TRADE",
            EnumSet.of(RecordKind.TRADOK, RecordKind.TRADCONFIRM, RecordKind.TRADERR),
            CollectionMode.SINGLE, "order_id");
    }

    /**
     * Check whether a record answers the given command.
     * ERR lines carry no identifying field and are accepted by every request.
     */
    public boolean matches(WireRecord record, Command command) {
        if (record.kind() == RecordKind.ERR) {
            return true;
        }
        if (!accepts.contains(record.kind())) {
            return false;
        }
        if (matchField == null || record.kind().field(matchField) == null || !command.has(matchField)) {
            return true;
        }
        return String.valueOf(command.params().get(matchField)).equals(String.valueOf(record.get(matchField)));
    }
}
