package io.laminar.cli.visualizer;

import io.laminar.core.model.Process;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.Map;
import java.util.TreeMap;

/// Registry and dispatcher for process visualization formats.
///
/// @implNote Thread-safe after construction. The format map is not modified afterwards.
/// @see VisualizationFormat
@ApplicationScoped
public class ProcessVisualizer {

    private final Map<String, VisualizationFormat> formats = new TreeMap<>();

    /// Creates a visualizer with every CDI-discovered format.
    ///
    /// @param formatInstances CDI-provided format implementations, not null
    @Inject
    public ProcessVisualizer(Instance<VisualizationFormat> formatInstances) {
        this(formatInstances.stream().toList());
    }

    /// Creates a visualizer with explicit formats.
    ///
    /// @param formats format implementations with unique names, not null
    public ProcessVisualizer(Iterable<VisualizationFormat> formats) {
        for (VisualizationFormat format : formats) {
            this.formats.put(format.getName(), format);
        }
    }

    /// Renders a process in the named format.
    ///
    /// @param process the process to render, not null
    /// @param formatName format name, e.g. "text" or "mermaid", not null
    /// @param useColor whether ANSI codes may be used
    /// @return rendered text, never null
    /// @throws IllegalArgumentException if no format has this name
    public String visualize(Process process, String formatName, boolean useColor) {
        VisualizationFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: "
                            + formatName
                            + ". Available: "
                            + String.join(", ", formats.keySet()));
        }
        return format.render(process, useColor);
    }

    /// Returns the registered format names in alphabetical order.
    public Iterable<String> getAvailableFormats() {
        return formats.keySet();
    }
}
