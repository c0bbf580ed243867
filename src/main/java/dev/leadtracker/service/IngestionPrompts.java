package dev.leadtracker.service;

/**
 * Prompt templates for the ingestion phases.
 */
final class IngestionPrompts {

    /** Answer the extraction prompt returns when the page holds no posting. */
    static final String NO_DESCRIPTION = "NONE";

    private IngestionPrompts() {
    }

    static String search(String queryText) {
        return """
                Search the web for this job search query: %s

                Find job postings that match this query. Extract basic info from search results.

                Return ONLY a JSON array of job objects, no other text:
                [
                  {
                    "company": "Company Name",
                    "title": "Job Title",
                    "link": "https://full-url-to-job-posting",
                    "location": "Location or Remote",
                    "description": "Brief 2-3 sentence summary of the role from search results",
                    "addressee": "Hiring Manager Name or null if not found"
                  }
                ]

                If no relevant jobs are found, return an empty array: []
                Focus on actual job postings, not job board listing pages.""".formatted(queryText);
    }

    static String extractDescription(String pageText) {
        return """
                Extract the job description from this job posting page content.
                Return ONLY the job description text, nothing else. If you cannot find a clear job description, return exactly: %s

                Page content:
                %s""".formatted(NO_DESCRIPTION, pageText);
    }

    static String filter(String background, String leadsSummary) {
        return """
                Review these job postings against the candidate's background and return only suitable matches.

                Candidate background:
                %s

                Job postings:
                %s

                Return ONLY a JSON array of index numbers for jobs that are a good fit for this candidate.
                Consider: relevant skills, experience level, job type, and location preferences.
                Be selective - only include jobs where there's a reasonable match.

                Example response: [0, 2, 5]
                If no jobs are suitable, return: []""".formatted(background, leadsSummary);
    }
}
