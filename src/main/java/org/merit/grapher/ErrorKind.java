package org.merit.grapher;

/**
 * Categories of recoverable failures reported to the user by the grapher window.
 */
public enum ErrorKind {
    INVALID_FILENAME,     // empty path or not a .csv file
    FILE_NOT_FOUND,       // the selected file does not exist
    PARSE_ERROR,          // a required numeric field could not be read
    FORMAT_ERROR,         // a timestamp matched neither epoch seconds nor the date pattern
    INVALID_WINDOW_VALUE  // smoothing or anomaly window is not a non-negative integer
}
