package phoenixcenter.defenceprofiler;


import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

@Log4j2
public class GlobalConfig {

    private static final String RESOURCE = "/defence-profiler.properties";

    private static Properties probs;

    static {
        try {
            init();
        } catch (IOException e) {
            throw new IllegalStateException("Global setting initialization error!!", e);
        }
    }

    /**
     * Initialize Properties
     *
     * @throws IOException
     */
    public static void init() throws IOException {
        probs = new Properties();
        try (InputStream in = GlobalConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IOException("classpath resource " + RESOURCE + " not found");
            }
            probs.load(in);
        }
        log.debug("loaded {} settings from {}", probs.size(), RESOURCE);
    }

    public static String getValue(String key) {
        return probs.getProperty(key);
    }

    public static int getIntValue(String key) {
        return Integer.parseInt(probs.getProperty(key));
    }

    public static double getDoubleValue(String key) {
        return Double.parseDouble(probs.getProperty(key));
    }

    /**
     * Comma separated value, each element trimmed, blanks dropped.
     */
    public static List<String> getListValue(String key) {
        String value = probs.getProperty(key, "");
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(e -> !e.isEmpty())
                .collect(Collectors.toList());
    }
}
