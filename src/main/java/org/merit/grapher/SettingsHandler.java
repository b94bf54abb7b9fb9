package org.merit.grapher;

import javax.swing.*;
import java.awt.*;
import java.awt.event.ActionEvent;
import java.awt.event.ActionListener;
import java.util.Dictionary;
import java.util.Hashtable;

/**
 * SettingsHandler is a JDialog allowing users to edit the grapher preferences
 * (date format, spinner step, band opacity, power unit) and writes them to config.xml on confirmation.
 */
public class SettingsHandler extends JDialog {
    private static final String[] UNIT_NAMES = {"W", "kW", "MW"};
    private static final double[] UNIT_SCALES = {1.0, 1000.0, 1_000_000.0};

    private final ResultsUI owner;

    private final JLabel infos;
    private final JTextField dateFormatText;
    private final JSpinner spinStepSpinner;
    private final JSlider bandAlphaSlider;
    private final JComboBox<String> unitComboBox;

    /**
     * @param owner   main window, receives the new settings on Apply
     * @param current settings to pre-fill the dialog with
     */
    public SettingsHandler(ResultsUI owner, GrapherSettings current) {
        super(owner, "Grapher settings", true);
        this.owner = owner;

        setLayout(new BorderLayout(10, 10));

        // Vertical stack of label/field pairs
        JPanel settingsPanel = new JPanel();
        settingsPanel.setLayout(new BoxLayout(settingsPanel, BoxLayout.Y_AXIS));
        settingsPanel.setBorder(BorderFactory.createTitledBorder("Settings for the results grapher"));

        infos = new JLabel("Select your settings and then press apply");
        infos.setAlignmentX(Component.LEFT_ALIGNMENT);

        // Date format shared by the loader, the date spinners and the time axis
        JLabel dateFormatLabel = new JLabel("Date format (e.g. yyyy-MM-dd HH:mm:ss):");
        dateFormatLabel.setAlignmentX(Component.LEFT_ALIGNMENT);
        dateFormatText = new JTextField(current.dateFormat(), 15);
        dateFormatText.setAlignmentX(Component.LEFT_ALIGNMENT);

        JLabel spinStepLabel = new JLabel("Step of the window spinners (minutes):");
        spinStepLabel.setAlignmentX(Component.LEFT_ALIGNMENT);
        spinStepSpinner = new JSpinner(new SpinnerNumberModel(current.spinStep(), 1, 1440, 1));
        spinStepSpinner.setAlignmentX(Component.LEFT_ALIGNMENT);

        // Opacity 0.0 - 1.0 mapped onto slider values 0 - 100
        JLabel bandAlphaLabel = new JLabel("Anomaly band opacity:");
        bandAlphaLabel.setAlignmentX(Component.LEFT_ALIGNMENT);
        int sliderValue = Math.max(0, Math.min(100, Math.round(current.bandAlpha() * 100)));
        bandAlphaSlider = new JSlider(0, 100, sliderValue);
        bandAlphaSlider.setAlignmentX(Component.LEFT_ALIGNMENT);
        bandAlphaSlider.setMajorTickSpacing(25);
        bandAlphaSlider.setMinorTickSpacing(5);
        bandAlphaSlider.setPaintTicks(true);
        bandAlphaSlider.setPaintLabels(true);

        Dictionary<Integer, JLabel> labelTable = new Hashtable<>();
        labelTable.put(0, new JLabel("0.0"));
        labelTable.put(50, new JLabel("0.5"));
        labelTable.put(100, new JLabel("1.0"));
        bandAlphaSlider.setLabelTable(labelTable);

        JLabel unitLabel = new JLabel("Power unit:");
        unitLabel.setAlignmentX(Component.LEFT_ALIGNMENT);
        unitComboBox = new JComboBox<>(UNIT_NAMES);
        unitComboBox.setAlignmentX(Component.LEFT_ALIGNMENT);
        unitComboBox.setSelectedIndex(unitIndex(current.powerScale()));

        settingsPanel.add(infos);
        settingsPanel.add(Box.createRigidArea(new Dimension(0, 10)));
        settingsPanel.add(dateFormatLabel);
        settingsPanel.add(Box.createRigidArea(new Dimension(0, 5)));
        settingsPanel.add(dateFormatText);
        settingsPanel.add(Box.createRigidArea(new Dimension(0, 5)));
        settingsPanel.add(spinStepLabel);
        settingsPanel.add(Box.createRigidArea(new Dimension(0, 5)));
        settingsPanel.add(spinStepSpinner);
        settingsPanel.add(Box.createRigidArea(new Dimension(0, 5)));
        settingsPanel.add(bandAlphaLabel);
        settingsPanel.add(Box.createRigidArea(new Dimension(0, 5)));
        settingsPanel.add(bandAlphaSlider);
        settingsPanel.add(Box.createRigidArea(new Dimension(0, 5)));
        settingsPanel.add(unitLabel);
        settingsPanel.add(Box.createRigidArea(new Dimension(0, 5)));
        settingsPanel.add(unitComboBox);

        JButton apply = new JButton("Apply Settings");
        apply.setAlignmentX(Component.LEFT_ALIGNMENT);
        settingsPanel.add(Box.createRigidArea(new Dimension(0, 20)));
        settingsPanel.add(apply);

        add(settingsPanel, BorderLayout.CENTER);
        apply.addActionListener(new applyEvent());

        pack();
        setLocationRelativeTo(owner);
    }

    // Index of the unit whose scale matches, kW when the config holds a custom scale
    private static int unitIndex(double scale) {
        for (int i = 0; i < UNIT_SCALES.length; i++) {
            if (UNIT_SCALES[i] == scale) return i;
        }
        return 1;
    }

    /**
     * Handles the "Apply Settings" button: validates the input, saves config.xml
     * and hands the new settings to the main window.
     */
    public class applyEvent implements ActionListener {
        @Override
        public void actionPerformed(ActionEvent e) {
            try {
                GrapherSettings updated = new GrapherSettings(
                        dateFormatText.getText().trim(),
                        (Integer) spinStepSpinner.getValue(),
                        bandAlphaSlider.getValue() / 100f,
                        UNIT_SCALES[unitComboBox.getSelectedIndex()],
                        owner.getSettings().lastDirectory()); // may have changed since the dialog opened

                ConfigHandler.saveConfig(updated.toConfig());
                owner.applySettings(updated);
                owner.log("Settings saved to config");

                setVisible(false);
                dispose();
            } catch (RuntimeException x) {
                // Invalid values from the record constructor or a failed config write
                x.printStackTrace();
                infos.setForeground(Color.RED);
                infos.setText("Wrong input: " + x.getMessage());
            }
        }
    }
}
