package com.talent.sourcing.query;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Standardized departments, with the title keywords used to infer them.
 * Inference checks departments in declaration order.
 */
public enum Department {
    ENGINEERING("Engineering and Technical", List.of("engineer", "engineering", "software", "developer",
            "technical", "infrastructure", "platform", "backend", "frontend", "full stack", "devops", "sre")),
    DATA_SCIENCE("Data Science", List.of("data", "ml", "machine learning", "ai", "artificial intelligence",
            "analytics", "data scientist", "research scientist")),
    PRODUCT("Product Management", List.of("product", "product manager", "pm", "product lead")),
    SALES("Sales", List.of("sales", "account executive", "business development", "bd")),
    MARKETING("Marketing", List.of("marketing", "growth", "content", "seo", "brand")),
    FINANCE("Finance & Accounting", List.of("finance", "accounting", "financial", "controller", "fp&a")),
    OPERATIONS("Operations", List.of("operations", "ops", "logistics", "supply chain")),
    HUMAN_RESOURCES("Human Resources", List.of("hr", "human resources", "recruiting", "recruiter", "talent")),
    C_SUITE("C-Suite", List.of("ceo", "cto", "cfo", "chief", "founder", "co-founder", "head of"));

    private final String label;
    private final List<Pattern> keywordPatterns;

    Department(String label, List<String> keywords) {
        this.label = label;
        this.keywordPatterns = keywords.stream()
                .map(k -> Pattern.compile("(?<![a-z])" + Pattern.quote(k) + "(?![a-z])"))
                .toList();
    }

    /**
     * Provider department value, e.g. "Engineering and Technical".
     */
    public String label() {
        return label;
    }

    /**
     * Infers the department from a job title, matching whole words only.
     */
    public static Optional<Department> infer(String roleTitle) {
        if (roleTitle == null || roleTitle.isBlank()) {
            return Optional.empty();
        }
        String normalized = roleTitle.toLowerCase(Locale.ROOT);
        for (Department department : values()) {
            for (Pattern pattern : department.keywordPatterns) {
                if (pattern.matcher(normalized).find()) {
                    return Optional.of(department);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Looks a department up by its label or enum name, ignoring case.
     */
    public static Optional<Department> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (Department department : values()) {
            if (department.label.equalsIgnoreCase(text.trim()) || department.name().equalsIgnoreCase(text.trim())) {
                return Optional.of(department);
            }
        }
        return Optional.empty();
    }
}
