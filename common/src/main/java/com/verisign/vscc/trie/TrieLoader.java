package com.verisign.vscc.trie;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Dictionary and configuration loading helpers.
 * <p/>
 * A dictionary is a text file with one <code>key&lt;separator&gt;value</code> per line.
 * A line without separator stores the key as its own value, blank lines and lines
 * starting with <code>#</code> are ignored.
 * <p/>
 * Files are searched on the filesystem first, then on the classpath.
 */
public class TrieLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TrieLoader.class);

    public static final String DEFAULT_SEPARATOR = "\t";
    public static final String COMMENT_PREFIX = "#";

    private final String separator;

    public TrieLoader() {
        this(DEFAULT_SEPARATOR);
    }

    public TrieLoader(String separator) {
        Preconditions.checkArgument(StringUtils.isNotEmpty(separator), "Invalid empty separator");
        this.separator = separator;
    }

    public CharTrie<String> load(String path) throws IOException {
        final CharTrie<String> trie = new CharTrie<>();
        loadInto(trie, path);
        return trie;
    }

    /**
     * Add all the entries of the dictionary into an existing trie.
     *
     * @return the number of entries added
     */
    public int loadInto(CharTrie<String> trie, String path) throws IOException {
        Preconditions.checkNotNull(trie);
        try (InputStream in = open(path)) {
            final int count = loadInto(trie, new InputStreamReader(in, StandardCharsets.UTF_8));
            LOG.info("Loaded {} entries from {}", count, path);
            return count;
        }
    }

    public int loadInto(CharTrie<String> trie, Reader reader) throws IOException {
        final BufferedReader lines = new BufferedReader(reader);
        int count = 0;
        int lineNumber = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            if (addLine(trie, line)) {
                count++;
            } else {
                LOG.debug("Skipped line {}: '{}'", lineNumber, line);
            }
        }
        return count;
    }

    @VisibleForTesting
    boolean addLine(CharTrie<String> trie, String line) {
        final String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX)) {
            return false;
        }
        final int index = trimmed.indexOf(separator);
        final String key;
        final String value;
        if (index < 0) {
            key = trimmed;
            value = trimmed;
        } else {
            key = trimmed.substring(0, index).trim();
            value = trimmed.substring(index + separator.length()).trim();
        }
        if (key.isEmpty()) {
            return false;
        }
        trie.add(key, value);
        return true;
    }

    public static Properties loadProperties(String path) throws IOException {
        final Properties prop = new Properties();
        try (InputStream in = open(path)) {
            prop.load(in);
        }
        return prop;
    }

    static InputStream open(String path) throws FileNotFoundException {
        Preconditions.checkNotNull(path, "path");
        final File file = new File(path);
        if (file.isFile()) {
            return new FileInputStream(file);
        }
        LOG.debug("File {} not found. Try via the resources", path);
        final InputStream inputStream = TrieLoader.class.getClassLoader().getResourceAsStream(path);
        if (inputStream == null) {
            throw new FileNotFoundException("Cannot find " + path + " on the filesystem nor in the resources");
        }
        return inputStream;
    }
}
