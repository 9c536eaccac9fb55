// file: cli/src/main/java/io/merklite/cli/JsonCliConfig.java
package io.merklite.cli;

/** Shape of the optional --config JSON file. Absent keys keep their defaults. */
public class JsonCliConfig {
    public String hashStrategy;
    public Boolean elideDuplicates;
    public Boolean skipBlankLines;
}
