package com.z254.campusvoice.voice.classification;

/**
 * Authority a complaint category is routed to.
 */
public record AuthorityRoute(String authority, String email, String department) {
}
