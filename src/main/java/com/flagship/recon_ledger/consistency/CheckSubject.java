package com.flagship.recon_ledger.consistency;

import lombok.Value;

import java.util.UUID;

/**
 * Something a consistency check is about: a transaction, match, entry or line.
 */
@Value
public class CheckSubject implements Comparable<CheckSubject> {
    SubjectType type;
    UUID id;

    public static CheckSubject transaction(UUID id) {
        return new CheckSubject(SubjectType.TRANSACTION, id);
    }

    public static CheckSubject match(UUID id) {
        return new CheckSubject(SubjectType.MATCH, id);
    }

    public static CheckSubject entry(UUID id) {
        return new CheckSubject(SubjectType.ENTRY, id);
    }

    public static CheckSubject line(UUID id) {
        return new CheckSubject(SubjectType.LINE, id);
    }

    @Override
    public int compareTo(CheckSubject other) {
        int byType = type.compareTo(other.type);
        return byType != 0 ? byType : id.compareTo(other.id);
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
