package com.molcollab.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the collaboration server
 * Binds to molcollab.* properties in application.yml
 */
@Configuration
@ConfigurationProperties(prefix = "molcollab")
public class CollaborationProperties {

    private WebSocketSettings websocket = new WebSocketSettings();
    private AuthSettings auth = new AuthSettings();
    private RoomSettings rooms = new RoomSettings();
    private RecordingSettings recording = new RecordingSettings();
    private ReplaySettings replay = new ReplaySettings();
    private ChatSettings chat = new ChatSettings();

    public WebSocketSettings getWebsocket() {
        return websocket;
    }

    public void setWebsocket(WebSocketSettings websocket) {
        this.websocket = websocket;
    }

    public AuthSettings getAuth() {
        return auth;
    }

    public void setAuth(AuthSettings auth) {
        this.auth = auth;
    }

    public RoomSettings getRooms() {
        return rooms;
    }

    public void setRooms(RoomSettings rooms) {
        this.rooms = rooms;
    }

    public RecordingSettings getRecording() {
        return recording;
    }

    public void setRecording(RecordingSettings recording) {
        this.recording = recording;
    }

    public ReplaySettings getReplay() {
        return replay;
    }

    public void setReplay(ReplaySettings replay) {
        this.replay = replay;
    }

    public ChatSettings getChat() {
        return chat;
    }

    public void setChat(ChatSettings chat) {
        this.chat = chat;
    }

    public static class WebSocketSettings {
        private String path = "/ws/collaboration";
        private int maxFrameBytes = 1024 * 1024; // 1 MiB

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getMaxFrameBytes() {
            return maxFrameBytes;
        }

        public void setMaxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
        }
    }

    public static class AuthSettings {
        // jwt | permissive
        private String mode = "jwt";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }

    public static class RoomSettings {
        private int actorThreads = 4;

        public int getActorThreads() {
            return actorThreads;
        }

        public void setActorThreads(int actorThreads) {
            this.actorThreads = actorThreads;
        }
    }

    public static class RecordingSettings {
        private int checkpointEvery = 200; // 0 disables checkpoints

        public int getCheckpointEvery() {
            return checkpointEvery;
        }

        public void setCheckpointEvery(int checkpointEvery) {
            this.checkpointEvery = checkpointEvery;
        }
    }

    public static class ReplaySettings {
        private long tickIntervalMs = 50;
        private double minSpeed = 0.1;
        private double maxSpeed = 10.0;

        public long getTickIntervalMs() {
            return tickIntervalMs;
        }

        public void setTickIntervalMs(long tickIntervalMs) {
            this.tickIntervalMs = tickIntervalMs;
        }

        public double getMinSpeed() {
            return minSpeed;
        }

        public void setMinSpeed(double minSpeed) {
            this.minSpeed = minSpeed;
        }

        public double getMaxSpeed() {
            return maxSpeed;
        }

        public void setMaxSpeed(double maxSpeed) {
            this.maxSpeed = maxSpeed;
        }
    }

    public static class ChatSettings {
        private int maxLength = 2000;

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }
    }
}
