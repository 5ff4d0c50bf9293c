package com.pipecache.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.pipecache.artifact.ReadMode;
import com.pipecache.index.WritePolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StoreConfig store = new StoreConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String root = ".pipecache/artifacts";
        private WritePolicy writePolicy = WritePolicy.REJECT;
        private ReadMode readMode = ReadMode.STREAMING;
        private boolean fileLocking = true;

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public WritePolicy getWritePolicy() {
            return writePolicy;
        }

        public void setWritePolicy(WritePolicy writePolicy) {
            this.writePolicy = writePolicy == null ? WritePolicy.REJECT : writePolicy;
        }

        public ReadMode getReadMode() {
            return readMode;
        }

        public void setReadMode(ReadMode readMode) {
            this.readMode = readMode == null ? ReadMode.STREAMING : readMode;
        }

        public boolean isFileLocking() {
            return fileLocking;
        }

        public void setFileLocking(boolean fileLocking) {
            this.fileLocking = fileLocking;
        }
    }
}
