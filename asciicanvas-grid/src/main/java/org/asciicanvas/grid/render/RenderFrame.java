package org.asciicanvas.grid.render;

import java.util.List;

/**
 * Output of one {@link GridRenderer#render} call.
 *
 * @param full     true when the frame repaints the whole surface
 * @param region   repainted rectangle (full grid for full frames)
 * @param commands ordered paint instructions
 */
public record RenderFrame(boolean full, DirtyRect region, List<RenderCommand> commands) {

    public RenderFrame {
        commands = List.copyOf(commands);
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }
}
