package com.newsrelay.service.format;

public record FormattedMessage(String text, String imageUrl) {
}
