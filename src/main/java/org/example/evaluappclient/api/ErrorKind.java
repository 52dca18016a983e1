package org.example.evaluappclient.api;

public enum ErrorKind {
    VALIDATION,               // Rejected locally, never sent
    UNRESOLVED_OPTION,        // Chosen label matches no option of the question
    CONNECTION,               // Network unreachable, refused or timed out
    HTTP,                     // Non-2xx, or a 2xx other than the one the call expects
    UNEXPECTED_CONTENT_TYPE,  // Success response that is not application/json
    DECODE                    // Malformed, too deep, or wrongly shaped JSON
}
