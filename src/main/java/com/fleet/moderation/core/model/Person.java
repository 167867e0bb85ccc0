package com.fleet.moderation.core.model;

/**
 * A natural person.
 *
 * @param id         numeric id
 * @param firstName  first name, may be null for deleted accounts
 * @param lastName   optional last name
 * @param username   optional handle without {@code @}
 * @param accessHash access credential, 0 if unknown
 */
public record Person(long id, String firstName, String lastName, String username, long accessHash)
        implements Identity {

    public static Person of(long id, String firstName) {
        return new Person(id, firstName, null, null, 0L);
    }

    @Override
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        sb.append(firstName != null && !firstName.isEmpty() ? firstName : String.valueOf(id));
        if (lastName != null && !lastName.isEmpty()) {
            sb.append(' ').append(lastName);
        }
        if (username != null && !username.isEmpty()) {
            sb.append(" (@").append(username).append(')');
        }
        return sb.toString();
    }
}
