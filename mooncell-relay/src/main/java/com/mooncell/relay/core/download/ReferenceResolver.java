package com.mooncell.relay.core.download;

import com.mooncell.relay.core.model.ReferenceKind;
import com.mooncell.relay.core.model.SourceReference;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析消息链接，支持以下形式（scheme 可省略，? 之后的参数会被忽略）：
 * <pre>
 *   t.me/&lt;username&gt;/&lt;msgId&gt;             公开频道
 *   t.me/c/&lt;internalId&gt;/&lt;msgId&gt;         私有频道，chatId 补 -100 前缀
 *   t.me/c/&lt;internalId&gt;/&lt;topic&gt;/&lt;msgId&gt; 私有频道话题
 *   t.me/b/&lt;name&gt;/&lt;msgId&gt;               按名称访问的私有会话
 * </pre>
 */
@Component
public class ReferenceResolver {

    static final String PRIVATE_CHAT_PREFIX = "-100";

    private static final Pattern LINK = Pattern.compile("^(?:https?://)?(?:www\\.)?(?:t\\.me|telegram\\.me|telegram\\.dog)/(.+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern USERNAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]{3,31}");
    private static final Pattern BOT_NAME = Pattern.compile("[A-Za-z0-9_]{3,64}");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,19}");

    public SourceReference resolve(String link) {
        if (link == null || link.isBlank()) {
            throw new InvalidReferenceException(String.valueOf(link), "empty link");
        }
        String trimmed = link.trim();
        Matcher matcher = LINK.matcher(trimmed);
        if (!matcher.matches()) {
            throw new InvalidReferenceException(link, "not a message link");
        }
        String path = stripSuffix(matcher.group(1));
        String[] parts = path.split("/");

        if ("c".equals(parts[0])) {
            requireLength(link, parts, 3, 4);
            String internalId = requireDigits(link, parts[1], "channel id");
            requireTopic(link, parts);
            long messageId = parseMessageId(link, parts[parts.length - 1]);
            return new SourceReference(PRIVATE_CHAT_PREFIX + internalId, messageId, ReferenceKind.PRIVATE_CHANNEL);
        }
        if ("b".equals(parts[0])) {
            requireLength(link, parts, 3, 4);
            if (!BOT_NAME.matcher(parts[1]).matches()) {
                throw new InvalidReferenceException(link, "bad chat name '" + parts[1] + "'");
            }
            requireTopic(link, parts);
            long messageId = parseMessageId(link, parts[parts.length - 1]);
            return new SourceReference(parts[1], messageId, ReferenceKind.PRIVATE_BY_NAME);
        }

        requireLength(link, parts, 2, 3);
        if (!USERNAME.matcher(parts[0]).matches()) {
            throw new InvalidReferenceException(link, "bad channel name '" + parts[0] + "'");
        }
        requireTopic(link, parts);
        long messageId = parseMessageId(link, parts[parts.length - 1]);
        return new SourceReference(parts[0], messageId, ReferenceKind.PUBLIC_CHANNEL);
    }

    /**
     * 从一条链接开始展开连续 count 条消息的链接
     */
    public List<String> expandRange(String link, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive");
        }
        SourceReference first = resolve(link);
        List<String> links = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            links.add(toLink(first.withOffset(i)));
        }
        return links;
    }

    public String toLink(SourceReference reference) {
        switch (reference.getKind()) {
            case PRIVATE_CHANNEL:
                return "https://t.me/c/" + reference.getChatId().substring(PRIVATE_CHAT_PREFIX.length()) + "/" + reference.getMessageId();
            case PRIVATE_BY_NAME:
                return "https://t.me/b/" + reference.getChatId() + "/" + reference.getMessageId();
            default:
                return "https://t.me/" + reference.getChatId() + "/" + reference.getMessageId();
        }
    }

    private static String stripSuffix(String path) {
        int cut = path.length();
        int query = path.indexOf('?');
        if (query >= 0) {
            cut = query;
        }
        int fragment = path.indexOf('#');
        if (fragment >= 0 && fragment < cut) {
            cut = fragment;
        }
        String stripped = path.substring(0, cut);
        while (stripped.endsWith("/")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped;
    }

    private static void requireLength(String link, String[] parts, int min, int max) {
        if (parts.length < min || parts.length > max) {
            throw new InvalidReferenceException(link, "unexpected path shape");
        }
    }

    // 带话题的链接：倒数第二段是话题 id
    private static void requireTopic(String link, String[] parts) {
        int maxShape = "c".equals(parts[0]) || "b".equals(parts[0]) ? 4 : 3;
        if (parts.length == maxShape) {
            requireDigits(link, parts[parts.length - 2], "topic id");
        }
    }

    private static String requireDigits(String link, String value, String what) {
        if (!DIGITS.matcher(value).matches()) {
            throw new InvalidReferenceException(link, "bad " + what + " '" + value + "'");
        }
        return value;
    }

    private static long parseMessageId(String link, String value) {
        requireDigits(link, value, "message id");
        long id = Long.parseLong(value);
        if (id <= 0) {
            throw new InvalidReferenceException(link, "message id must be positive");
        }
        return id;
    }
}
