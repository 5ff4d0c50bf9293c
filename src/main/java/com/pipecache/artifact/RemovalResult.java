package com.pipecache.artifact;

public record RemovalResult(int artifactsRemoved, int payloadsDeleted) {
}
