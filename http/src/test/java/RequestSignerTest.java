import io.github.flameyossnowy.simpledb.http.Credentials;
import io.github.flameyossnowy.simpledb.http.ServiceRequest;
import io.github.flameyossnowy.simpledb.http.signing.RequestSigner;
import io.github.flameyossnowy.simpledb.http.signing.SignatureMethod;
import io.github.flameyossnowy.simpledb.http.signing.UrlEncoding;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RequestSignerTest {
    static final Credentials CREDENTIALS = new Credentials("AKIDEXAMPLE", "wJalrXUtnFEMI/K7MDENG/bPxRfiCYEXAMPLEKEY");
    static final Clock CLOCK = Clock.fixed(Instant.parse("2010-01-25T15:01:28Z"), ZoneOffset.UTC);

    static final String EXPECTED_BASE_STRING = "POST\n"
        + "sdb.amazonaws.com\n"
        + "/\n"
        + "AWSAccessKeyId=AKIDEXAMPLE&Action=PutAttributes&Attribute.0.Name=name&Attribute.0.Replace=true"
        + "&Attribute.0.Value=O%27Brien%20%26%20co~&DomainName=users&ItemName=item%201"
        + "&SignatureMethod=HmacSHA256&SignatureVersion=2&Timestamp=2010-01-25T15%3A01%3A28&Version=2009-04-15";
    static final String EXPECTED_SIGNATURE = "URsqGWdcwOLdpj+kR/hdk+4QOrEf6gnbRtpYT1wLQJk=";

    private static ServiceRequest putRequest() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("Version", "2009-04-15");
        parameters.put("ItemName", "item 1");
        parameters.put("Action", "PutAttributes");
        parameters.put("DomainName", "users");
        parameters.put("Attribute.0.Name", "name");
        parameters.put("Attribute.0.Value", "O'Brien & co~");
        parameters.put("Attribute.0.Replace", "true");
        return ServiceRequest.post(URI.create("https://sdb.amazonaws.com"), parameters);
    }

    @Test
    void sign_reproducesKnownSignature() {
        RequestSigner signer = new RequestSigner(CREDENTIALS, SignatureMethod.HMAC_SHA256, CLOCK);

        ServiceRequest signed = signer.sign(putRequest());

        assertEquals("AKIDEXAMPLE", signed.parameter("AWSAccessKeyId"));
        assertEquals("2", signed.parameter("SignatureVersion"));
        assertEquals("HmacSHA256", signed.parameter("SignatureMethod"));
        assertEquals("2010-01-25T15:01:28", signed.parameter("Timestamp"));
        assertEquals(EXPECTED_BASE_STRING, RequestSigner.baseString(signed));
        assertEquals(EXPECTED_SIGNATURE, signed.parameter("Signature"));
    }

    @Test
    void sign_isDeterministic() {
        RequestSigner signer = new RequestSigner(CREDENTIALS, SignatureMethod.HMAC_SHA256, CLOCK);

        assertEquals(signer.sign(putRequest()), signer.sign(putRequest()));
    }

    @Test
    void sign_withSha1UsesItsOwnMethodName() {
        RequestSigner signer = new RequestSigner(CREDENTIALS, SignatureMethod.HMAC_SHA1, CLOCK);

        ServiceRequest signed = signer.sign(putRequest());

        assertEquals("HmacSHA1", signed.parameter("SignatureMethod"));
        assertNotEquals(EXPECTED_SIGNATURE, signed.parameter("Signature"));
        assertEquals(28, signed.parameter("Signature").length());
    }

    @Test
    void baseString_lowercasesHostAndKeepsPath() {
        ServiceRequest request = ServiceRequest.post(URI.create("http://SDB.Example.COM/some/path"), Map.of("b", "2", "a", "1"));

        assertEquals("POST\nsdb.example.com\n/some/path\na=1&b=2", RequestSigner.baseString(request));
    }

    @Test
    void baseString_keepsExplicitPort() {
        ServiceRequest request = ServiceRequest.post(URI.create("http://LocalHost:8080/"), Map.of("a", "1"));

        assertEquals("POST\nlocalhost:8080\n/\na=1", RequestSigner.baseString(request));
    }

    @Test
    void baseString_skipsExistingSignature() {
        ServiceRequest request = ServiceRequest.post(URI.create("https://sdb.amazonaws.com/"), Map.of("a", "1", "Signature", "old"));

        assertEquals("POST\nsdb.amazonaws.com\n/\na=1", RequestSigner.baseString(request));
    }

    @Test
    void preferredMethod_isSha256OnStandardRuntimes() {
        assertEquals(SignatureMethod.HMAC_SHA256, SignatureMethod.preferred());
    }

    @Test
    void urlEncoding_keepsOnlyUnreservedCharacters() {
        assertEquals("AZaz09-_.~", UrlEncoding.encode("AZaz09-_.~"));
        assertEquals("a%20b%2Bc%2A%2F", UrlEncoding.encode("a b+c*/"));
        assertEquals("%C3%A9%E2%82%AC", UrlEncoding.encode("é€"));
    }

    @Test
    void formBody_usesSameEscaping() {
        ServiceRequest request = ServiceRequest.post(URI.create("https://sdb.amazonaws.com"), new LinkedHashMap<>(Map.of("k", "a b")));

        assertEquals("k=a%20b", request.formBody());
    }

    @Test
    void credentials_hideSecret() {
        assertFalse(CREDENTIALS.toString().contains("wJalr"));
    }
}
