package org.merit.grapher;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * <h1>ConfigHandler</h1>
 * Utility class for managing the grapher's configuration file (config.xml).
 * <p>
 * The file stores flat key-value pairs under a {@code <config>} root element:
 * <pre>
 * &lt;config&gt;
 *     &lt;dateFormat&gt;yyyy-MM-dd HH:mm:ss&lt;/dateFormat&gt;
 *     &lt;spinStep&gt;5&lt;/spinStep&gt;
 *     ...
 * &lt;/config&gt;
 * </pre>
 * Provides methods to:
 * <ul>
 *     <li>Load configuration settings from the XML file.</li>
 *     <li>Save updated configuration settings to the XML file.</li>
 *     <li>Create a default configuration file with preset settings.</li>
 * </ul>
 * The no-argument variants use config.xml in the current working directory.
 */
public final class ConfigHandler {

    private ConfigHandler() {
    }

    /**
     * @return location of config.xml in the working directory.
     */
    public static Path defaultConfigPath() {
        return Paths.get(System.getProperty("user.dir"), "config.xml");
    }

    public static String[][] loadConfig() {
        return loadConfig(defaultConfigPath());
    }

    /**
     * Loads configuration settings from the given file.
     * If the file does not exist or is corrupted, creates a default config and reloads.
     *
     * @param configPath location of the XML file
     * @return a 2D String array containing key-value pairs of config settings.
     */
    public static String[][] loadConfig(Path configPath) {
        try {
            // Parse the XML file into a DOM Document object
            DocumentBuilder dBuilder = DocumentBuilderFactory.newInstance().newDocumentBuilder();
            Document doc = dBuilder.parse(configPath.toFile());

            // Combine adjacent text nodes so each value is a single text node
            doc.getDocumentElement().normalize();

            NodeList nodeList = doc.getDocumentElement().getChildNodes();

            // Count only ELEMENT_NODEs, whitespace between elements also shows up as child nodes
            int numEntries = 0;
            for (int i = 0; i < nodeList.getLength(); i++) {
                if (nodeList.item(i).getNodeType() == Node.ELEMENT_NODE) {
                    numEntries++;
                }
            }

            String[][] values = new String[numEntries][2];

            int entryIndex = 0;
            for (int i = 0; i < nodeList.getLength(); i++) {
                Node node = nodeList.item(i);
                if (node.getNodeType() == Node.ELEMENT_NODE) {
                    values[entryIndex][0] = node.getNodeName();      // element name is the key
                    values[entryIndex][1] = node.getTextContent();   // text content is the value
                    entryIndex++;
                }
            }

            return values;

        } catch (Exception e) {
            // Missing or unreadable file: write the defaults and load those instead
            System.out.println("Config error - Create new config " + e.getMessage());
            createConfig(configPath);
            return loadConfig(configPath);
        }
    }

    public static void saveConfig(String[][] values) {
        saveConfig(values, defaultConfigPath());
    }

    /**
     * Saves the provided key-value settings into the config file, replacing its contents.
     *
     * @param values     2D String array containing [key][value] pairs to write to the config file.
     * @param configPath location of the XML file
     * @throws RuntimeException if any IO or XML error occurs during save.
     */
    public static void saveConfig(String[][] values, Path configPath) {
        try {
            Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();

            Element rootElement = document.createElement("config");
            document.appendChild(rootElement);

            // One child element per entry
            for (String[] entry : values) {
                Element element = document.createElement(entry[0]);
                element.appendChild(document.createTextNode(entry[1]));
                rootElement.appendChild(element);
            }

            writeDocument(document, configPath);
            System.out.println("Config file saved successfully!");

        } catch (Exception e) {
            e.printStackTrace();
            throw new RuntimeException(e);
        }
    }

    public static void createConfig() {
        createConfig(defaultConfigPath());
    }

    /**
     * Creates a new default configuration file, overwriting any existing one.
     * Called automatically if the config file is missing or corrupted.
     *
     * @param configPath location of the XML file
     * @throws RuntimeException if file creation or XML operations fail.
     */
    public static void createConfig(Path configPath) {
        try {
            Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();

            Element root = doc.createElement("config");
            doc.appendChild(root);

            // Defaults come from GrapherSettings so both places agree
            for (String[] entry : GrapherSettings.defaults().toConfig()) {
                Element element = doc.createElement(entry[0]);
                element.appendChild(doc.createTextNode(entry[1]));
                root.appendChild(element);
            }

            writeDocument(doc, configPath);
            System.out.println("Config file created successfully!");

        } catch (Exception e) {
            e.printStackTrace();
            throw new RuntimeException(e);
        }
    }

    // Pretty prints the document to the given file
    private static void writeDocument(Document document, Path configPath) throws Exception {
        Transformer transformer = TransformerFactory.newInstance().newTransformer();
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "4");

        transformer.transform(new DOMSource(document), new StreamResult(configPath.toFile()));
    }
}
