package io.github.eutro.irgraph.edit;

public class NoModuleLoadedException extends EditException {
    public NoModuleLoadedException() {
        super("no module loaded");
    }
}
