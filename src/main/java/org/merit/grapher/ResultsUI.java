package org.merit.grapher;

import com.formdev.flatlaf.themes.FlatMacDarkLaf;
import org.jfree.chart.ChartPanel;

import javax.swing.*;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.*;
import java.awt.event.ActionEvent;
import java.awt.event.ActionListener;
import java.io.File;
import java.text.ParseException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Calendar;
import java.util.Date;

/**
 * ResultsUI is the main window of the results grapher.
 * <p>
 * It lets the user pick a results CSV, choose the date range to plot and toggle the
 * smoothing and anomaly band options, then redraws the {@link ResultsGraph} on request.
 * <p>
 * Core responsibilities:
 * <ul>
 *   <li>Builds the graph area, the file/date panel, the options panel, the status bar and the log area.</li>
 *   <li>Owns the currently loaded {@link ResultsData}; a new file replaces it completely.</li>
 *   <li>Runs loader → transform → renderer synchronously on the event dispatch thread.</li>
 *   <li>Turns every {@link GrapherException} into a status message or an error dialog.</li>
 * </ul>
 */
public class ResultsUI extends JFrame {
    /**
     * How long transient status bar messages stay visible.
     */
    private static final int STATUS_TIMEOUT_MS = 5000;

    private GrapherSettings settings;
    private ResultsLoader loader;
    private final ResultsGraph graph;

    /**
     * Dataset of the last successfully loaded file, {@code null} until the first load.
     */
    private ResultsData data;

    // File and date range controls
    private JTextField fileEdit;
    private JSpinner startDate;
    private JSpinner endDate;

    // Options panel, disabled until a file is loaded
    private JPanel optionsWidget;
    private JPanel settingsWidget;
    private JCheckBox smoothBox;
    private JSpinner smoothSpin;
    private JCheckBox anomalyBox;
    private JSpinner anomalySpin;

    // Status bar and log window
    private final JLabel statusLabel = new JLabel(" ");
    private final Timer statusTimer;
    private JTextArea logTextArea;

    /**
     * Builds the window for the given settings. Nothing is loaded yet.
     */
    public ResultsUI(GrapherSettings settings) {
        this.settings = settings;
        this.loader = new ResultsLoader(settings.formatter(), ZoneId.systemDefault());
        this.graph = new ResultsGraph(settings);

        setTitle("Results Grapher");
        setLayout(new BorderLayout());
        setJMenuBar(createMenuBar());

        // Clears the status bar once a transient message has expired
        statusTimer = new Timer(STATUS_TIMEOUT_MS, e -> statusLabel.setText(" "));
        statusTimer.setRepeats(false);

        JPanel mainWidget = new JPanel(new BorderLayout(5, 5));
        mainWidget.add(graphWidget(), BorderLayout.CENTER);
        settingsWidget = settingsWidget();
        mainWidget.add(settingsWidget, BorderLayout.SOUTH);

        add(mainWidget, BorderLayout.CENTER);
        add(statusBar(), BorderLayout.SOUTH);
    }

    /**
     * Main entry point. Sets up the look and feel, loads config.xml (or creates it)
     * and opens the window. An optional first argument names a results file to open right away.
     *
     * @param args optional path of a results CSV
     */
    public static void main(String[] args) {
        try {
            // --- FlatLaf Mac Dark Look and Feel with rounded components ---
            FlatMacDarkLaf.setup();
            UIManager.put("Component.arc", 20);
            UIManager.put("Button.arc", 20);
            UIManager.put("TextComponent.arc", 20);
            UIManager.put("ProgressBar.arc", 20);
            UIManager.put("CheckBox.arc", 20);
            UIManager.put("Spinner.arc", 20);
            UIManager.put("PopupMenu.arc", 20);
            UIManager.put("ScrollBar.thumbArc", 20);
            UIManager.put("Slider.trackArc", 20);
            UIManager.put("Slider.thumbArc", 20);
            UIManager.put("ComboBox.arc", 20);
        } catch (Exception ex) {
            // The default look and feel still works
            ex.printStackTrace();
        }

        GrapherSettings settings = loadSettings();

        SwingUtilities.invokeLater(() -> {
            ResultsUI gui = new ResultsUI(settings);
            gui.setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
            gui.setSize(1200, 800);
            gui.setLocation(50, 50);
            gui.setVisible(true);
            gui.log("Config loaded");

            if (args.length > 0) {
                gui.fileEdit.setText(args[0]);
                gui.openFile();
            }
        });
    }

    /**
     * Reads config.xml, recreating it with defaults when a value is out of range.
     */
    static GrapherSettings loadSettings() {
        try {
            return GrapherSettings.fromConfig(ConfigHandler.loadConfig());
        } catch (IllegalArgumentException e) {
            System.out.println("Config error - Create new config " + e.getMessage());
            ConfigHandler.createConfig();
            return GrapherSettings.defaults();
        }
    }

    //==================== WIDGETS ====================//

    // Chart with JFreeChart's built-in zoom, pan and save popup menu
    private JComponent graphWidget() {
        ChartPanel chartPanel = new ChartPanel(graph.getChart());
        chartPanel.setMouseWheelEnabled(true);
        chartPanel.setPreferredSize(new Dimension(1100, 550));
        return chartPanel;
    }

    // File/date panel on the left, options panel on the right
    private JPanel settingsWidget() {
        JPanel panel = new JPanel(new GridLayout(1, 2, 10, 0));
        panel.add(fileWidget());
        optionsWidget = optionsWidget();
        setPanelEnabled(optionsWidget, false);
        panel.add(optionsWidget);
        return panel;
    }

    private JPanel fileWidget() {
        JPanel panel = new JPanel(new GridBagLayout());
        panel.setBorder(BorderFactory.createTitledBorder("Results file"));

        JButton fileBrowse = new JButton("Browse...");
        fileBrowse.addActionListener(new eventBrowse());
        fileEdit = new JTextField(30);
        fileEdit.addActionListener(new eventOpen()); // enter in the path field opens it

        startDate = createDateSpinner();
        endDate = createDateSpinner();

        addRow(panel, 0, fileBrowse, fileEdit);
        addRow(panel, 1, new JLabel("Start Date: "), startDate);
        addRow(panel, 2, new JLabel("End Date: "), endDate);
        return panel;
    }

    private JPanel optionsWidget() {
        JPanel panel = new JPanel(new GridBagLayout());
        panel.setBorder(BorderFactory.createTitledBorder("Options"));

        smoothBox = new JCheckBox("Smooth data (minutes):");
        smoothBox.addItemListener(e -> smoothToggled(smoothBox.isSelected()));
        smoothSpin = new JSpinner(new SpinnerNumberModel(0, 0, 0, settings.spinStep()));
        smoothSpin.setEnabled(false);

        anomalyBox = new JCheckBox("Show anomalies (minutes):");
        anomalyBox.addItemListener(e -> anomalyToggled(anomalyBox.isSelected()));
        anomalySpin = new JSpinner(new SpinnerNumberModel(0, 0, 0, settings.spinStep()));
        anomalySpin.setEnabled(false);

        JButton update = new JButton("Update Graph");
        update.addActionListener(new eventUpdateGraph());
        JButton reset = new JButton("Reset");
        reset.addActionListener(new eventReset());

        addRow(panel, 0, smoothBox, smoothSpin);
        addRow(panel, 1, anomalyBox, anomalySpin);
        addRow(panel, 2, reset, update);
        return panel;
    }

    private JPanel statusBar() {
        JPanel panel = new JPanel(new BorderLayout());

        // Log area for system messages, kept small under the controls
        logTextArea = new JTextArea(3, 20);
        logTextArea.setEditable(false);
        logTextArea.setLineWrap(true);
        logTextArea.setWrapStyleWord(true);
        JScrollPane logScrollPane = new JScrollPane(logTextArea);
        logScrollPane.setPreferredSize(new Dimension(200, 60));

        statusLabel.setBorder(BorderFactory.createEmptyBorder(2, 6, 2, 6));
        panel.add(logScrollPane, BorderLayout.CENTER);
        panel.add(statusLabel, BorderLayout.SOUTH);
        return panel;
    }

    private JMenuBar createMenuBar() {
        JMenuBar menuBar = new JMenuBar();

        JMenu file = new JMenu("File");
        JMenu settingsMenu = new JMenu("Settings");

        JMenuItem open = new JMenuItem("Open results file");
        JMenuItem reload = new JMenuItem("Reload file");
        JMenuItem exit = new JMenuItem("Exit");
        JMenuItem settingHandler = new JMenuItem("Open settings");

        file.add(open);
        file.add(reload);
        file.addSeparator();
        file.add(exit);
        settingsMenu.add(settingHandler);

        menuBar.add(file);
        menuBar.add(settingsMenu);

        open.addActionListener(new eventBrowse());
        reload.addActionListener(new eventOpen());
        exit.addActionListener(new eventExit());
        settingHandler.addActionListener(new eventSettings());
        return menuBar;
    }

    private JSpinner createDateSpinner() {
        JSpinner spinner = new JSpinner(new SpinnerDateModel(new Date(), null, null, Calendar.MINUTE));
        spinner.setEditor(new JSpinner.DateEditor(spinner, settings.dateFormat()));
        return spinner;
    }

    // Label or button in column 0, stretching field in column 1
    private static void addRow(JPanel panel, int row, JComponent left, JComponent right) {
        GridBagConstraints c = new GridBagConstraints();
        c.gridy = row;
        c.insets = new Insets(3, 3, 3, 3);
        c.anchor = GridBagConstraints.WEST;

        c.gridx = 0;
        panel.add(left, c);

        c.gridx = 1;
        c.weightx = 1.0;
        c.fill = GridBagConstraints.HORIZONTAL;
        panel.add(right, c);
    }

    //==================== ACTIONS ====================//

    /**
     * Opens the file chooser, then loads and draws the chosen file with both options switched off.
     */
    public void browseFile() {
        JFileChooser fileChooser = new JFileChooser(settings.lastDirectory().isEmpty() ? null : settings.lastDirectory());
        fileChooser.setDialogTitle("Open results file");
        fileChooser.setFileFilter(new FileNameExtensionFilter("CSV files", "csv"));

        if (fileChooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }

        File selected = fileChooser.getSelectedFile();
        fileEdit.setText(selected.getPath());

        // Remember the directory for the next time the chooser opens
        if (selected.getParent() != null) {
            settings = settings.withLastDirectory(selected.getParent());
            try {
                ConfigHandler.saveConfig(settings.toConfig());
            } catch (RuntimeException e) {
                log("Could not save config: " + e.getMessage());
            }
        }

        openFile();
    }

    /**
     * Loads the file named in the path field and, on success, draws it from scratch.
     */
    public void openFile() {
        smoothBox.setSelected(false);
        anomalyBox.setSelected(false);

        if (loadFile()) {
            setPanelEnabled(optionsWidget, true);
            updateGraph();
        }
    }

    /**
     * Loads the file named in the path field.
     * <p>
     * On success the dataset is replaced, the date range is reset to cover every sample
     * and the window spinners are limited to the number of samples. On failure the previous
     * dataset stays as it was and the reason is shown in the status bar.
     *
     * @return whether a new dataset was loaded
     */
    public boolean loadFile() {
        String filename = fileEdit.getText().trim();
        try {
            ResultsData loaded = loader.loadFile(filename);
            data = loaded;

            // End bound is exclusive, so step past the last sample
            GraphOptions range = GraphOptions.fullRange(loaded);
            startDate.setValue(toDate(range.start()));
            endDate.setValue(toDate(range.end()));

            int maxWindow = loaded.size() - 1;
            ((SpinnerNumberModel) smoothSpin.getModel()).setMaximum(maxWindow);
            ((SpinnerNumberModel) anomalySpin.getModel()).setMaximum(maxWindow);

            log(String.format("Loaded %d samples from %s%s", loaded.size(), new File(filename).getName(),
                    loaded.hasAnomalies() ? "" : " (no anomaly column)"));
            return true;
        } catch (GrapherException e) {
            showStatus(e.getMessage(), 0);
            log(e.getMessage());
            return false;
        }
    }

    /**
     * Enables the smoothing spinner while the checkbox is ticked; unticking disables it and resets it to 0.
     */
    public void smoothToggled(boolean selected) {
        smoothSpin.setEnabled(selected);
        if (!selected) smoothSpin.setValue(0);
    }

    /**
     * Same as {@link #smoothToggled(boolean)} for the anomaly window spinner.
     */
    public void anomalyToggled(boolean selected) {
        anomalySpin.setEnabled(selected);
        if (!selected) anomalySpin.setValue(0);
    }

    /**
     * Recomputes the view for the current selections and redraws the graph.
     * The controls are disabled and a loading indicator is shown while it runs.
     */
    public void updateGraph() {
        if (data == null) {
            showStatus("Error: no results file loaded", STATUS_TIMEOUT_MS);
            return;
        }

        setPanelEnabled(settingsWidget, false);
        LoadingWindow loadingWin = new LoadingWindow(this);
        loadingWin.open();

        try {
            GraphView view = DataTransform.prepare(data, readOptions());
            graph.show(view, anomalyBox.isSelected());

            if (view.isEmpty()) {
                showStatus("No samples between the selected dates.", STATUS_TIMEOUT_MS);
            } else {
                if (anomalyBox.isSelected() && !data.hasAnomalies()) {
                    log("File has no anomaly column, no bands drawn");
                }
                showStatus("Graphing complete.", STATUS_TIMEOUT_MS);
            }
        } catch (GrapherException e) {
            JOptionPane.showMessageDialog(this, e.getMessage(), "Error", JOptionPane.ERROR_MESSAGE);
            log(e.getMessage());
        } catch (RuntimeException e) {
            e.printStackTrace();
            log("Error drawing graph: " + e.getMessage());
        } finally {
            loadingWin.close();
            setPanelEnabled(settingsWidget, true);
        }
    }

    /**
     * Switches both options off and draws the full dataset again.
     */
    public void resetOptions() {
        if (data == null) return;

        smoothBox.setSelected(false);
        anomalyBox.setSelected(false);
        graph.clearSpans();

        GraphOptions range = GraphOptions.fullRange(data);
        startDate.setValue(toDate(range.start()));
        endDate.setValue(toDate(range.end()));
        updateGraph();
    }

    /**
     * Collects the current widget values into {@link GraphOptions}.
     *
     * @throws GrapherException {@link ErrorKind#INVALID_WINDOW_VALUE} if a window spinner holds no integer
     */
    GraphOptions readOptions() throws GrapherException {
        int smoothingWindow = smoothBox.isSelected() ? readWindow(smoothSpin, "Smoothing window") : 0;
        int anomalyWindow = anomalyBox.isSelected() ? readWindow(anomalySpin, "Anomaly window") : 0;

        return new GraphOptions(
                toLocalDateTime((Date) startDate.getValue()),
                toLocalDateTime((Date) endDate.getValue()),
                smoothingWindow,
                anomalyWindow);
    }

    // Commits whatever was typed into the spinner before reading it
    private static int readWindow(JSpinner spinner, String label) throws GrapherException {
        try {
            spinner.commitEdit();
        } catch (ParseException e) {
            throw new GrapherException(ErrorKind.INVALID_WINDOW_VALUE, label + " must be integer value.", e);
        }
        return DataTransform.parseWindow(spinner.getValue(), label);
    }

    /**
     * Takes over new settings from the settings dialog and redraws with them.
     */
    public void applySettings(GrapherSettings updated) {
        this.settings = updated;
        this.loader = new ResultsLoader(updated.formatter(), ZoneId.systemDefault());
        graph.applySettings(updated);

        ((SpinnerNumberModel) smoothSpin.getModel()).setStepSize(updated.spinStep());
        ((SpinnerNumberModel) anomalySpin.getModel()).setStepSize(updated.spinStep());
        startDate.setEditor(new JSpinner.DateEditor(startDate, updated.dateFormat()));
        endDate.setEditor(new JSpinner.DateEditor(endDate, updated.dateFormat()));

        if (data != null) updateGraph();
    }

    public GrapherSettings getSettings() {
        return settings;
    }

    //==================== HELPERS ====================//

    /**
     * Shows a message in the status bar.
     *
     * @param message   text to show
     * @param timeoutMs how long to keep it, 0 keeps it until the next message
     */
    public void showStatus(String message, int timeoutMs) {
        statusTimer.stop();
        statusLabel.setText(message);
        if (timeoutMs > 0) {
            statusTimer.setInitialDelay(timeoutMs);
            statusTimer.restart();
        }
    }

    /**
     * Appends a line to the log window and scrolls to it.
     */
    public void log(String message) {
        logTextArea.append(message + "\n");
        logTextArea.setCaretPosition(logTextArea.getDocument().getLength());
    }

    // Enables or disables a panel together with everything inside it
    private void setPanelEnabled(Container container, boolean enabled) {
        container.setEnabled(enabled);
        for (Component component : container.getComponents()) {
            component.setEnabled(enabled);
            if (component instanceof Container) {
                setPanelEnabled((Container) component, enabled);
            }
        }
        // Spinners follow their checkbox, not the panel
        if (enabled && container == optionsWidget) {
            smoothSpin.setEnabled(smoothBox.isSelected());
            anomalySpin.setEnabled(anomalyBox.isSelected());
        }
    }

    private static Date toDate(LocalDateTime ldt) {
        return Date.from(ldt.atZone(ZoneId.systemDefault()).toInstant());
    }

    private static LocalDateTime toLocalDateTime(Date date) {
        return LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault());
    }

    //==================== EVENT HANDLERS ====================//

    /**
     * Opens the file chooser.
     */
    public class eventBrowse implements ActionListener {
        @Override
        public void actionPerformed(ActionEvent e) {
            browseFile();
        }
    }

    /**
     * Loads (or reloads) the file typed into the path field.
     */
    public class eventOpen implements ActionListener {
        @Override
        public void actionPerformed(ActionEvent e) {
            openFile();
        }
    }

    public class eventUpdateGraph implements ActionListener {
        @Override
        public void actionPerformed(ActionEvent e) {
            updateGraph();
        }
    }

    public class eventReset implements ActionListener {
        @Override
        public void actionPerformed(ActionEvent e) {
            resetOptions();
        }
    }

    /**
     * Opens the settings dialog pre-filled with the current settings.
     */
    public class eventSettings implements ActionListener {
        @Override
        public void actionPerformed(ActionEvent e) {
            SettingsHandler dialog = new SettingsHandler(ResultsUI.this, settings);
            dialog.setVisible(true);
        }
    }

    /**
     * Saves the config and exits the application.
     */
    public class eventExit implements ActionListener {
        @Override
        public void actionPerformed(ActionEvent e) {
            ConfigHandler.saveConfig(settings.toConfig());
            System.out.println("Exit application");
            System.exit(0);
        }
    }
}
