package net.parley.proto;

import java.util.logging.Logger;

public class DirectoryGC implements Runnable {

    private static final Logger LOGGER = Logger.getLogger("DirGC");

    public static final long DEFAULT_INTERVAL = 60000;

    private final ChannelDirectory directory;

    public DirectoryGC(ChannelDirectory directory) {
        this.directory = directory;
    }

    public ChannelDirectory getDirectory() {
        return directory;
    }

    public void run() {
        LOGGER.finer("Compacting channel directory...");
        int removed = directory.compact();
        if (removed != 0)
            LOGGER.fine("Removed " + removed + " stale channel(s)");
    }

}
