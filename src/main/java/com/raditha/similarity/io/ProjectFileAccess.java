package com.raditha.similarity.io;

import java.io.IOException;
import java.util.List;

/**
 * Access to the files of a project. Implementations decide where the files
 * live; the analyzer only lists and reads them.
 */
public interface ProjectFileAccess {

    /**
     * List the text files of a project.
     *
     * @param projectPath Project root
     * @return Paths of the text files, in a stable order
     * @throws IOException if the project cannot be listed
     */
    List<String> listProjectTextFiles(String projectPath) throws IOException;

    /**
     * Read a text file.
     *
     * @param path A path returned by {@link #listProjectTextFiles(String)} or
     *             supplied directly by the caller
     * @return File content
     * @throws IOException if the file cannot be read
     */
    String readTextFile(String path) throws IOException;
}
