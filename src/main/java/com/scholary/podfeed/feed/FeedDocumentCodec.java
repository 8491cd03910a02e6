package com.scholary.podfeed.feed;

import com.rometools.modules.itunes.EntryInformationImpl;
import com.rometools.modules.itunes.FeedInformationImpl;
import com.rometools.modules.itunes.ITunes;
import com.rometools.modules.itunes.types.Category;
import com.rometools.modules.itunes.types.Duration;
import com.rometools.rome.feed.WireFeed;
import com.rometools.rome.feed.module.Module;
import com.rometools.rome.feed.rss.Channel;
import com.rometools.rome.feed.rss.Description;
import com.rometools.rome.feed.rss.Enclosure;
import com.rometools.rome.feed.rss.Guid;
import com.rometools.rome.feed.rss.Item;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.WireFeedInput;
import com.rometools.rome.io.WireFeedOutput;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Reads and writes the feed document as RSS 2.0 with the iTunes podcast extension.
 *
 * <p>Per item: {@code guid} (not a permalink) carries the entry id, {@code enclosure} the media
 * URL, length and type, {@code itunes:duration} and {@code itunes:image} the optional duration and
 * artwork. Only guid and enclosure are mandatory when reading; everything else may be missing.
 */
public class FeedDocumentCodec {

  private static final String RSS_VERSION = "rss_2.0";

  private final FeedProperties properties;

  public FeedDocumentCodec(FeedProperties properties) {
    this.properties = properties;
  }

  /**
   * Serialize entries, in the given order, to {@code out}.
   *
   * @throws IOException if the document cannot be produced or written
   */
  public void write(List<FeedEntry> entries, Instant lastBuild, OutputStream out)
      throws IOException {
    Channel channel = new Channel(RSS_VERSION);
    channel.setTitle(properties.title());
    channel.setLink(properties.siteUrl());
    channel.setDescription(properties.description());
    channel.setLanguage(properties.language());
    channel.setGenerator("podfeed");
    channel.setLastBuildDate(Date.from(lastBuild));
    channel.setModules(new ArrayList<>(List.of(channelModule())));
    channel.setItems(entries.stream().map(this::toItem).toList());

    String xml;
    try {
      xml = stripEmptyItunesKeywords(new WireFeedOutput().outputString(channel, true));
    } catch (FeedException e) {
      throw new IOException("Failed to build RSS XML", e);
    }
    out.write(xml.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Parse a feed document.
   *
   * @throws FeedPersistException if the document is not RSS or an item lacks guid/enclosure
   */
  public List<FeedEntry> read(InputStream in) {
    WireFeed feed;
    try {
      feed = new WireFeedInput().build(new InputStreamReader(in, StandardCharsets.UTF_8));
    } catch (FeedException | IllegalArgumentException e) {
      throw new FeedPersistException("Feed document is not valid RSS: " + e.getMessage(), e);
    }
    if (!(feed instanceof Channel)) {
      throw new FeedPersistException("Feed document is not RSS: " + feed.getFeedType());
    }

    List<FeedEntry> entries = new ArrayList<>();
    for (Item item : ((Channel) feed).getItems()) {
      entries.add(fromItem(item));
    }
    return entries;
  }

  private Item toItem(FeedEntry entry) {
    Item item = new Item();
    item.setTitle(entry.title());
    if (entry.description() != null) {
      Description description = new Description();
      description.setType("text/plain");
      description.setValue(entry.description());
      item.setDescription(description);
    }
    if (entry.sourceLink() != null) {
      item.setLink(entry.sourceLink());
    }
    item.setPubDate(Date.from(entry.publishedAt()));

    Guid guid = new Guid();
    guid.setPermaLink(false);
    guid.setValue(entry.id());
    item.setGuid(guid);

    Enclosure enclosure = new Enclosure();
    enclosure.setUrl(entry.mediaUrl());
    enclosure.setType(entry.mimeType());
    enclosure.setLength(Math.max(entry.fileSizeBytes(), 0L));
    item.setEnclosures(List.of(enclosure));

    boolean hasImage = entry.imageUrl() != null && !entry.imageUrl().isBlank();
    if (entry.durationSeconds() != null || hasImage) {
      EntryInformationImpl iTunes = new EntryInformationImpl();
      if (entry.durationSeconds() != null) {
        iTunes.setDuration(new Duration(entry.durationSeconds() * 1000L));
      }
      if (hasImage) {
        iTunes.setImageUri(entry.imageUrl());
      }
      List<Module> modules = new ArrayList<>(item.getModules());
      modules.add(iTunes);
      item.setModules(modules);
    }
    return item;
  }

  private FeedEntry fromItem(Item item) {
    Guid guid = item.getGuid();
    if (guid == null || guid.getValue() == null || guid.getValue().isBlank()) {
      throw new FeedPersistException("Feed item without guid: " + item.getTitle());
    }
    if (item.getEnclosures() == null || item.getEnclosures().isEmpty()) {
      throw new FeedPersistException("Feed item without enclosure: " + guid.getValue());
    }
    Enclosure enclosure = item.getEnclosures().get(0);
    if (enclosure.getUrl() == null) {
      throw new FeedPersistException("Feed item enclosure without url: " + guid.getValue());
    }

    Long durationSeconds = null;
    String imageUrl = null;
    Module module = item.getModule(ITunes.URI);
    if (module instanceof EntryInformationImpl) {
      EntryInformationImpl iTunes = (EntryInformationImpl) module;
      Duration duration = iTunes.getDuration();
      if (duration != null) {
        durationSeconds = duration.getMilliseconds() / 1000L;
      }
      imageUrl = iTunes.getImageUri();
    }

    return new FeedEntry(
        guid.getValue().trim(),
        item.getTitle(),
        item.getDescription() == null ? null : item.getDescription().getValue(),
        durationSeconds,
        enclosure.getUrl(),
        enclosure.getType(),
        enclosure.getLength(),
        item.getPubDate() == null ? Instant.EPOCH : item.getPubDate().toInstant(),
        item.getLink(),
        imageUrl);
  }

  private FeedInformationImpl channelModule() {
    FeedInformationImpl iTunes = new FeedInformationImpl();
    iTunes.setAuthor(properties.author());
    iTunes.setSummary(properties.description());
    iTunes.setExplicit(false);
    iTunes.setOwnerName(properties.author());
    if (properties.category() != null && !properties.category().isBlank()) {
      iTunes.setCategories(List.of(new Category(properties.category())));
    }
    if (properties.imageUrl() != null && !properties.imageUrl().isBlank()) {
      iTunes.setImageUri(properties.imageUrl());
    }
    return iTunes;
  }

  // rome-modules emits empty itunes:keywords by default.
  private static String stripEmptyItunesKeywords(String xml) {
    return xml.replace("<itunes:keywords />", "")
        .replace("<itunes:keywords/>", "")
        .replace("<itunes:keywords></itunes:keywords>", "");
  }
}
