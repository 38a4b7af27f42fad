package com.github.dimitryivaniuta.newsletter.service.dto;

/**
 * Content sent to every subscriber of an issue.
 *
 * @param title email subject
 * @param textContent plain text part
 * @param htmlContent HTML part
 */
public record IssueContent(String title, String textContent, String htmlContent) {}
