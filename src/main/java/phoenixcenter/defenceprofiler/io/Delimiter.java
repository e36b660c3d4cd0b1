package phoenixcenter.defenceprofiler.io;

import org.apache.commons.text.StringEscapeUtils;
import org.apache.commons.text.StringTokenizer;

import java.util.Arrays;
import java.util.List;

/**
 * Field separators of the tables this tool reads and writes.
 */
public enum Delimiter {

    TAB {
        @Override
        public List<String> split(String line) {
            return Arrays.asList(line.split("\t", -1));
        }

        @Override
        public String escape(String value) {
            return value.replace('\t', ' ').replace('\n', ' ').replace('\r', ' ');
        }

        @Override
        public String separator() {
            return "\t";
        }
    },

    /**
     * RFC 4180 style, double quoted fields may hold commas and doubled quotes.
     */
    COMMA {
        @Override
        public List<String> split(String line) {
            return StringTokenizer.getCSVInstance(line).getTokenList();
        }

        @Override
        public String escape(String value) {
            return StringEscapeUtils.escapeCsv(value);
        }

        @Override
        public String separator() {
            return ",";
        }
    };

    public abstract List<String> split(String line);

    public abstract String escape(String value);

    public abstract String separator();
}
