package dev.folio.search.lexical;

import dev.folio.document.Chunk;
import dev.folio.exception.BackendUnavailableException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory Lucene full-text index scored with BM25 (k1 = 1.2, b = 0.75) over English-stemmed
 * chunk text.
 *
 * <p>Query text is analysed with the same analyzer and turned into a disjunction of term queries,
 * so user input never has to be escaped for a query parser. Writes are serialised; searches run
 * concurrently against the latest refreshed searcher.
 */
public class LuceneBm25Index implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(LuceneBm25Index.class);

  static final String CHUNK_ID = "chunk_id";
  static final String DOCUMENT_ID = "document_id";
  static final String CONTENT = "content";

  private final String name;
  private final Directory directory;
  private final Analyzer analyzer;
  private final IndexWriter writer;
  private final SearcherManager searcherManager;

  public LuceneBm25Index(String name) {
    this.name = name;
    this.directory = new ByteBuffersDirectory();
    this.analyzer = new EnglishAnalyzer();
    try {
      IndexWriterConfig config = new IndexWriterConfig(analyzer);
      config.setSimilarity(new BM25Similarity(1.2f, 0.75f));
      this.writer = new IndexWriter(directory, config);
      this.writer.commit();
      this.searcherManager = new SearcherManager(writer, null);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to initialise BM25 index " + name, e);
    }
  }

  public String name() {
    return name;
  }

  /** Adds or replaces chunks, keyed by chunk id. */
  public synchronized void add(List<Chunk> chunks) {
    if (chunks.isEmpty()) {
      return;
    }
    try {
      for (Chunk chunk : chunks) {
        Document doc = new Document();
        doc.add(new StringField(CHUNK_ID, chunk.id(), Field.Store.YES));
        doc.add(new StringField(DOCUMENT_ID, chunk.sourceDocumentId(), Field.Store.NO));
        doc.add(new TextField(CONTENT, chunk.text(), Field.Store.NO));
        writer.updateDocument(new Term(CHUNK_ID, chunk.id()), doc);
      }
      writer.commit();
      searcherManager.maybeRefresh();
    } catch (IOException e) {
      throw new BackendUnavailableException(name, "failed to index chunks", e);
    }
    log.debug("Indexed {} chunks into {}", chunks.size(), name);
  }

  public synchronized void removeDocument(String sourceDocumentId) {
    try {
      writer.deleteDocuments(new Term(DOCUMENT_ID, sourceDocumentId));
      writer.commit();
      searcherManager.maybeRefresh();
    } catch (IOException e) {
      throw new BackendUnavailableException(name, "failed to remove " + sourceDocumentId, e);
    }
  }

  /**
   * Runs a BM25 search.
   *
   * @param text free query text
   * @param k maximum number of hits
   * @return hits with a positive score, best first; empty when the text has no indexable terms
   * @throws BackendUnavailableException on an index read failure
   */
  public List<LexicalHit> search(String text, int k) {
    List<String> terms = analyze(text);
    if (terms.isEmpty()) {
      return List.of();
    }
    BooleanQuery.Builder query = new BooleanQuery.Builder();
    for (String term : terms) {
      query.add(new TermQuery(new Term(CONTENT, term)), BooleanClause.Occur.SHOULD);
    }

    try {
      IndexSearcher searcher = searcherManager.acquire();
      try {
        TopDocs topDocs = searcher.search(query.build(), k);
        List<LexicalHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
        for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
          if (scoreDoc.score > 0) {
            Document doc = searcher.storedFields().document(scoreDoc.doc);
            hits.add(new LexicalHit(doc.get(CHUNK_ID), scoreDoc.score));
          }
        }
        return hits;
      } finally {
        searcherManager.release(searcher);
      }
    } catch (IOException e) {
      throw new BackendUnavailableException(name, "BM25 search failed", e);
    }
  }

  /** Number of live chunks in the index. */
  public int size() {
    try {
      IndexSearcher searcher = searcherManager.acquire();
      try {
        return searcher.getIndexReader().numDocs();
      } finally {
        searcherManager.release(searcher);
      }
    } catch (IOException e) {
      throw new BackendUnavailableException(name, "failed to read index size", e);
    }
  }

  private List<String> analyze(String text) {
    Set<String> terms = new LinkedHashSet<>();
    try (TokenStream stream = analyzer.tokenStream(CONTENT, text)) {
      CharTermAttribute attribute = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      while (stream.incrementToken() && terms.size() < IndexSearcher.getMaxClauseCount()) {
        terms.add(attribute.toString());
      }
      stream.end();
    } catch (IOException e) {
      throw new BackendUnavailableException(name, "failed to analyse query", e);
    }
    return List.copyOf(terms);
  }

  @Override
  public synchronized void close() {
    try {
      searcherManager.close();
      writer.close();
      directory.close();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close BM25 index " + name, e);
    } finally {
      analyzer.close();
    }
  }
}
