package com.z254.campusvoice.voice.classification;

import com.z254.campusvoice.voice.domain.model.Category;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed routing table from complaint category to the responsible authority.
 * Unrecognized categories resolve to the {@code other} entry.
 */
@Component
public class AuthorityDirectory {

    private static final Map<Category, AuthorityRoute> ROUTES;

    static {
        Map<Category, AuthorityRoute> routes = new EnumMap<>(Category.class);
        routes.put(Category.FOOD, new AuthorityRoute(
                "Mess Committee Head", "mess@srec.ac.in", "Mess & Catering Services"));
        routes.put(Category.INFRASTRUCTURE, new AuthorityRoute(
                "Maintenance Officer", "maintenance@srec.ac.in", "Infrastructure & Maintenance"));
        routes.put(Category.ACADEMIC, new AuthorityRoute(
                "Academic Dean", "academics@srec.ac.in", "Academic Affairs"));
        routes.put(Category.HOSTEL, new AuthorityRoute(
                "Hostel Warden", "hostel@srec.ac.in", "Hostel Administration"));
        routes.put(Category.TRANSPORT, new AuthorityRoute(
                "Transport Coordinator", "transport@srec.ac.in", "Transport Services"));
        routes.put(Category.OTHER, new AuthorityRoute(
                "Student Affairs Officer", "studentaffairs@srec.ac.in", "Student Affairs"));
        ROUTES = Collections.unmodifiableMap(routes);
    }

    public AuthorityRoute routeFor(Category category) {
        return ROUTES.getOrDefault(category, ROUTES.get(Category.OTHER));
    }

    public AuthorityRoute routeFor(String category) {
        return routeFor(Category.from(category));
    }

    public Map<Category, AuthorityRoute> routes() {
        return ROUTES;
    }
}
