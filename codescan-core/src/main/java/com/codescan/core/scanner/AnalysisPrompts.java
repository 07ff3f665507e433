package com.codescan.core.scanner;

import java.nio.file.Path;

/**
 * Prompts sent to the analysis provider.
 */
public final class AnalysisPrompts {

    private AnalysisPrompts() {
    }

    /**
     * Builds the prompt asking for the findings of one file.
     *
     * @param file file path
     * @param language language of the file
     * @param content full file content
     * @return prompt text
     */
    public static String forFile(Path file, String language, String content) {
        return """
            Analyze the following %s code for security vulnerabilities, potential bugs and bad practices.
            File path: %s

            Pay particular attention to:
            1. Common security vulnerabilities such as SQL injection and XSS
            2. Unsafe dependencies and API usage
            3. Hard-coded secrets and credentials
            4. Unhandled errors and exceptions
            5. Memory and resource leaks
            6. Logic errors
            7. Code quality problems

            ```
            %s
            ```

            Return the result in the following JSON format:
            ```json
            [
              {
                "severity": "critical|high|medium|low|info",
                "description": "description of the problem",
                "line_number": 42,
                "code_snippet": "the offending code",
                "recommendation": "how to fix it",
                "cwe_id": "CWE identifier",
                "confidence": "high|medium|low"
              }
            ]
            ```
            If no problems are found, return an empty array [].
            """.formatted(language, file, content);
    }

    /**
     * Builds the prompt asking for a project summary.
     *
     * @param directory project directory
     * @param statistics statistics rendered as JSON
     * @param mainLanguage most frequent language
     * @param tree directory tree rendered as JSON
     * @return prompt text
     */
    public static String forProject(Path directory, String statistics, String mainLanguage, String tree) {
        return """
            Based on the following project statistics, analyze the type, structure and main functionality of this project.

            Project path: %s
            Main language: %s
            Statistics:
            %s

            Directory structure:
            %s

            Provide:
            1. The rough type and purpose of the project
            2. Its main components and modules
            3. An overview of its architecture
            4. Likely use cases

            Answer with a strict JSON object containing the fields:
            - "project_type": type of project
            - "main_functionality": main functionality
            - "components": list of main components
            - "architecture": short architecture description
            - "use_cases": list of likely use cases

            Make sure the answer is valid JSON without any extra text, code fences or explanations.
            """.formatted(directory, mainLanguage, statistics, tree);
    }
}
