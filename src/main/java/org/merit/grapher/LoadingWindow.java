package org.merit.grapher;

import javax.swing.*;
import java.awt.*;

/**
 * Small undecorated-looking dialog with an endless progress bar, shown while the graph is recomputed.
 * It is modeless so the redraw can run on the event dispatch thread right after it appears.
 */
public class LoadingWindow extends JDialog {

    public LoadingWindow(Frame owner) {
        super(owner, " ", false);
        setAlwaysOnTop(true);
        setDefaultCloseOperation(WindowConstants.DO_NOTHING_ON_CLOSE);

        JPanel panel = new JPanel();
        panel.setLayout(new BoxLayout(panel, BoxLayout.Y_AXIS));
        panel.setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10));

        JLabel label = new JLabel("Updating. Please wait...");
        label.setAlignmentX(Component.LEFT_ALIGNMENT);

        // Indeterminate: no progress is reported, the bar just keeps moving
        JProgressBar progress = new JProgressBar();
        progress.setIndeterminate(true);
        progress.setAlignmentX(Component.LEFT_ALIGNMENT);

        panel.add(label);
        panel.add(Box.createRigidArea(new Dimension(0, 5)));
        panel.add(progress);

        add(panel);
        pack();
        setLocationRelativeTo(owner);
    }

    /**
     * Shows the dialog and paints it immediately, before the caller blocks the event dispatch thread.
     */
    public void open() {
        setVisible(true);
        JComponent content = (JComponent) getContentPane();
        content.paintImmediately(content.getBounds());
    }

    public void close() {
        setVisible(false);
        dispose();
    }
}
