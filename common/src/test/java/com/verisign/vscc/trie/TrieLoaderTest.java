package com.verisign.vscc.trie;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.Properties;

public class TrieLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testLoadFromClasspath() throws IOException {
        CharTrie<String> trie = new TrieLoader().load("dictionary.tsv");

        Assert.assertEquals(Collections.singletonList("7"), trie.get("to"));
        Assert.assertEquals(Arrays.asList("tea", "ted", "ten"), trie.search("te").keys());
        Assert.assertEquals(Arrays.asList("3", "4", "12"), trie.search("te").values());
        Assert.assertEquals(Arrays.asList("i", "in", "inn"), trie.search("i").keys());
    }

    @Test
    public void testLoadFromFile() throws IOException {
        File file = folder.newFile("words.csv");
        Files.write(file.toPath(), Arrays.asList("apple;1", " apple ; 2 ", "# comment", "", "banana"),
                StandardCharsets.UTF_8);

        TrieLoader loader = new TrieLoader(";");
        CharTrie<String> trie = new CharTrie<>();
        int count = loader.loadInto(trie, file.getAbsolutePath());

        Assert.assertEquals(3, count);
        Assert.assertEquals(Arrays.asList("1", "2"), trie.get("apple"));
        Assert.assertEquals(Collections.singletonList("banana"), trie.get("banana"));
        Assert.assertFalse(trie.isNode("#"));
    }

    @Test
    public void testSkipsLinesWithoutKey() throws IOException {
        CharTrie<String> trie = new CharTrie<>();
        int count = new TrieLoader(";").loadInto(trie, new StringReader(" ;value\nkey;value\n"));

        Assert.assertEquals(1, count);
        Assert.assertTrue(trie.isMember("key"));
        Assert.assertFalse(trie.isMember("value"));
    }

    @Test
    public void testIndentedLineWithSpaceSeparator() throws IOException {
        CharTrie<String> trie = new CharTrie<>();
        int count = new TrieLoader(" ").loadInto(trie, new StringReader("  apple 1\n\tbanana  2 \n"));

        Assert.assertEquals(2, count);
        Assert.assertEquals(Collections.singletonList("1"), trie.get("apple"));
        Assert.assertEquals(Collections.singletonList("2"), trie.get("banana"));
    }

    @Test(expected = FileNotFoundException.class)
    public void testMissingDictionary() throws IOException {
        new TrieLoader().load("does-not-exist.tsv");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptySeparator() {
        new TrieLoader("");
    }

    @Test
    public void testLoadProperties() throws IOException {
        File file = folder.newFile("trie.properties");
        Files.write(file.toPath(), Collections.singletonList("trie.separator=;"), StandardCharsets.UTF_8);

        Properties properties = TrieLoader.loadProperties(file.getAbsolutePath());
        Assert.assertEquals(";", properties.getProperty("trie.separator"));
    }
}
