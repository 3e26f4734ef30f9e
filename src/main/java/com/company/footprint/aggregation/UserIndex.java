package com.company.footprint.aggregation;

import java.util.*;

/**
 * Dense, sorted numbering of the logins a run may encounter.
 */
public class UserIndex {

    private final List<String> logins;
    private final Map<String, Integer> positions;

    public UserIndex(Collection<String> logins) {
        this.logins = List.copyOf(new TreeSet<>(logins));
        this.positions = new HashMap<>();
        for (int i = 0; i < this.logins.size(); i++) {
            positions.put(this.logins.get(i), i);
        }
    }

    /**
     * @return the user's position, or -1 if the login is unknown
     */
    public int indexOf(String login) {
        Integer i = positions.get(login);
        return i != null ? i : -1;
    }

    public String loginAt(int index) {
        return logins.get(index);
    }

    public int size() {
        return logins.size();
    }

    public List<String> getLogins() {
        return logins;
    }
}
