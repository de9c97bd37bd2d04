package com.ndcheck.proof;

import com.ndcheck.logic.SubproofKind;
import com.ndcheck.syntax.Formula;
import com.ndcheck.syntax.Justification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fitch boxes as an explicit stack of frames over a flat list of lines. Each line
 * remembers the frame it was written in; a line is citable while that frame is still
 * on the stack. Owned by one {@link ProofDriver} run.
 */
public class ContextStack implements ContextView {

    private static final int ROOT_FRAME = 0;

    private final List<ProofLine> lines = new ArrayList<>();
    private final List<Integer> lineFrames = new ArrayList<>();
    private final List<SubproofFrame> frames = new ArrayList<>();
    private final Map<Integer, ClosedSubproof> closedByFirstLine = new HashMap<>();
    private int nextFrameId = ROOT_FRAME + 1;

    /**
     * Append a premise or derived line at the current depth.
     */
    public ProofLine append(Formula formula, LineRole role, Justification justification,
                            boolean established, String source) {
        return materialize(formula, role, justification, null, established, source);
    }

    /**
     * Push a frame and append the line that opens it.
     */
    public ProofLine openSubproof(Formula assumption, SubproofKind kind, boolean established, String source) {
        int openedAt = nextIndex();
        frames.add(new SubproofFrame(nextFrameId++, openedAt, assumption, frames.size() + 1, kind));
        return materialize(assumption, LineRole.ASSUMPTION, null, kind, established, source);
    }

    /**
     * Pop the innermost frame and record it as a citable range.
     *
     * @throws IllegalStateException if no subproof is open
     */
    public ClosedSubproof closeSubproof() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("No open subproof");
        }
        SubproofFrame frame = frames.remove(frames.size() - 1);
        int first = frame.getOpenedAtLine();
        int last = lines.size();
        ProofLine opening = lines.get(first - 1);
        ProofLine closing = lines.get(last - 1);
        ClosedSubproof closed = new ClosedSubproof(first, last, frame.getAssumption(), closing.getFormula(),
            frame.getKind(), currentFrameId(), opening.isEstablished() && closing.isEstablished());
        closedByFirstLine.put(first, closed);
        return closed;
    }

    public boolean hasOpenSubproof() {
        return !frames.isEmpty();
    }

    public List<ProofLine> lines() {
        return Collections.unmodifiableList(lines);
    }

    public List<SubproofFrame> openFrames() {
        return Collections.unmodifiableList(frames);
    }

    @Override
    public int nextIndex() {
        return lines.size() + 1;
    }

    @Override
    public int depth() {
        return frames.size();
    }

    @Override
    public ProofLine line(int index) {
        if (index < 1 || index > lines.size()) {
            return null;
        }
        return lines.get(index - 1);
    }

    @Override
    public boolean isOpen(int index) {
        return line(index) != null && stackPosition(lineFrames.get(index - 1)) >= 0;
    }

    @Override
    public int worldDistance(int index) {
        return strictFramesAbove(stackPosition(lineFrames.get(index - 1)));
    }

    @Override
    public ClosedSubproof closedSubproof(int first, int last) {
        ClosedSubproof closed = closedByFirstLine.get(first);
        if (closed == null || closed.getLast() != last) {
            return null;
        }
        return closed;
    }

    @Override
    public boolean isVisible(ClosedSubproof subproof) {
        int position = stackPosition(subproof.getParentFrameId());
        return position >= 0 && strictFramesAbove(position) == 0;
    }

    @Override
    public List<Formula> openHypotheses() {
        List<Formula> out = new ArrayList<>();
        for (ProofLine line : lines) {
            if (line.getRole() == LineRole.PREMISE && line.getFormula() != null) {
                out.add(line.getFormula());
            }
        }
        for (SubproofFrame frame : frames) {
            if (frame.getAssumption() != null) {
                out.add(frame.getAssumption());
            }
        }
        return out;
    }

    @Override
    public List<ProofLine> availableLines() {
        List<ProofLine> out = new ArrayList<>();
        for (ProofLine line : lines) {
            if (line.getFormula() != null && isOpen(line.getIndex())) {
                out.add(line);
            }
        }
        return out;
    }

    private ProofLine materialize(Formula formula, LineRole role, Justification justification,
                                  SubproofKind opens, boolean established, String source) {
        ProofLine line = new ProofLine(nextIndex(), frames.size(), formula, role, justification,
            opens, established, source);
        lines.add(line);
        lineFrames.add(currentFrameId());
        return line;
    }

    private int currentFrameId() {
        return frames.isEmpty() ? ROOT_FRAME : frames.get(frames.size() - 1).getId();
    }

    // 0 for the top level, i + 1 for frames.get(i), -1 once the frame is closed
    private int stackPosition(int frameId) {
        if (frameId == ROOT_FRAME) {
            return 0;
        }
        for (int i = 0; i < frames.size(); i++) {
            if (frames.get(i).getId() == frameId) {
                return i + 1;
            }
        }
        return -1;
    }

    private int strictFramesAbove(int position) {
        int count = 0;
        for (int i = position; i < frames.size(); i++) {
            if (frames.get(i).isStrict()) {
                count++;
            }
        }
        return count;
    }
}
